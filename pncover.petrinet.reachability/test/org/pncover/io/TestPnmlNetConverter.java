package org.pncover.io;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;
import org.pncover.exceptions.InputException;
import org.pncover.model.Marking;
import org.pncover.model.PetriNet;
import org.pncover.utils.StringFileIO;

public class TestPnmlNetConverter {

    private static final String PLAIN = "<pnml><net id=\"n\"><page id=\"pg\">"
            + "<place id=\"a\"><initialMarking><text>2</text></initialMarking></place>"
            + "<place id=\"b\"/>"
            + "<transition id=\"t\"/>"
            + "<arc id=\"x\" source=\"a\" target=\"t\"><inscription><text>2</text></inscription></arc>"
            + "<arc id=\"y\" source=\"t\" target=\"b\"/>"
            + "<arc id=\"z\" source=\"a\" target=\"b\"/>"
            + "</page></net></pnml>";

    @Test
    public void convertsNamespacedPnml() throws Exception {
        PnmlNetConverter converter = new PnmlNetConverter();
        NetInput input = converter.convert(StringFileIO.readResourceAsString("nets/two-cycle.pnml"));
        PetriNet net = input.getNet();

        Assert.assertFalse(input.hasSubnetDefinitions());
        Assert.assertEquals(Arrays.asList("p0", "p1"), converter.getPlaceIds());
        Assert.assertEquals(Arrays.asList("start", "finish"), converter.getTransitionIds());
        Assert.assertEquals(Marking.of(1, 0), net.getInitialMarking());
        Assert.assertArrayEquals(new int[] { 1, 0 }, net.getConsumption()[0]);
        Assert.assertArrayEquals(new int[] { 0, 1 }, net.getConsumption()[1]);
        Assert.assertArrayEquals(new int[] { 0, 1 }, net.getProduction()[0]);
        Assert.assertArrayEquals(new int[] { 1, 0 }, net.getProduction()[1]);
        Assert.assertEquals(0, converter.getSkippedArcCount());
    }

    @Test
    public void convertsPlainPnmlAndSkipsPlaceToPlaceArcs() throws Exception {
        PnmlNetConverter converter = new PnmlNetConverter();
        PetriNet net = converter.convert(PLAIN).getNet();

        Assert.assertEquals(Marking.of(2, 0), net.getInitialMarking());
        Assert.assertEquals(2, net.consumption(0, 0));
        Assert.assertEquals(1, net.production(1, 0));
        Assert.assertEquals(1, converter.getSkippedArcCount());
    }

    @Test
    public void emitsEngineJson() throws Exception {
        String json = new PnmlNetConverter().toEngineJson(PLAIN);
        NetInput input = new NetInputParser().parse(json);
        Assert.assertEquals(Marking.of(2, 0), input.getNet().getInitialMarking());
        Assert.assertFalse(input.hasSubnetDefinitions());
    }

    @Test
    public void rejectsBadDocuments() {
        assertRejected("<pnml><net>");
        assertRejected("");
        assertRejected("<pnml><net><place id=\"a\"/></net></pnml>");
        assertRejected("<pnml><net><place id=\"a\"><initialMarking><text>x</text></initialMarking></place>"
                + "<transition id=\"t\"/></net></pnml>");
        assertRejected("<pnml><net><place id=\"a\"/><transition id=\"a\"/></net></pnml>");
        assertRejected("<pnml><net><place/><transition id=\"t\"/></net></pnml>");
    }

    private static void assertRejected(String pnml) {
        try {
            new PnmlNetConverter().convert(pnml);
            Assert.fail("accepted " + pnml);
        } catch (InputException e) {
            Assert.assertEquals(InputException.ERROR_CODE, e.getErrorCode());
        }
    }
}
