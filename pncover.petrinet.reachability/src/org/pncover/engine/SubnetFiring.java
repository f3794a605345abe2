package org.pncover.engine;

import org.pncover.model.Marking;
import org.pncover.model.Subnet;

/**
 * The computation a subnet worker runs for each request.
 */
@FunctionalInterface
interface SubnetFiring {
    int[] fire(Subnet subnet, Marking global, int transition);
}
