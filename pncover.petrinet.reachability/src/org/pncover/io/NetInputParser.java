package org.pncover.io;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.pncover.exceptions.InputException;
import org.pncover.json.JsonArrayReader;
import org.pncover.json.JsonValidator;
import org.pncover.model.PetriNet;
import org.pncover.model.SubnetDefinition;
import org.pncover.utils.StringFileIO;

/**
 * Reads and writes the engine's JSON net format:
 *
 * <pre>
 * { "M0": [1, 0],
 *   "I_minus": [[1, 0], [0, 1]],
 *   "I_plus":  [[0, 1], [1, 0]],
 *   "subnet_definitions": [ {"id": 0, "place_indices": [0, 1], "trans_indices": [0, 1]} ] }
 * </pre>
 *
 * Matrices are place-major. {@code subnet_definitions} is optional.
 */
public class NetInputParser {

    private static final Logger logger = Logger.getLogger(NetInputParser.class);

    public static final String FIELD_M0 = "M0";
    public static final String FIELD_I_MINUS = "I_minus";
    public static final String FIELD_I_PLUS = "I_plus";
    public static final String FIELD_SUBNETS = "subnet_definitions";
    public static final String FIELD_ID = "id";
    public static final String FIELD_PLACES = "place_indices";
    public static final String FIELD_TRANSITIONS = "trans_indices";

    public NetInput parseFile(String path) throws InputException {
        String json;
        try {
            json = StringFileIO.readFileAsString(path);
        } catch (IOException e) {
            throw new InputException("Cannot read net file " + path, e);
        }
        return parse(json);
    }

    public NetInput parse(String json) throws InputException {
        JSONObject root = JsonValidator.parseObject(json);
        JsonValidator.requireFields(root, FIELD_M0, FIELD_I_MINUS, FIELD_I_PLUS);

        int[] m0 = JsonArrayReader.getIntArray(root, FIELD_M0);
        int[][] iMinus = JsonArrayReader.getIntMatrix(root, FIELD_I_MINUS);
        int[][] iPlus = JsonArrayReader.getIntMatrix(root, FIELD_I_PLUS);
        PetriNet net = PetriNet.create(m0, iMinus, iPlus);

        List<SubnetDefinition> definitions = null;
        if (root.get(FIELD_SUBNETS) != null) {
            definitions = parseSubnets(JsonArrayReader.getArray(root, FIELD_SUBNETS));
        }
        logger.debug("Parsed " + net + (definitions == null ? " without subnet definitions"
                : " with " + definitions.size() + " subnet definitions"));
        return new NetInput(net, definitions);
    }

    private List<SubnetDefinition> parseSubnets(JSONArray array) throws InputException {
        List<SubnetDefinition> definitions = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            Object entry = array.get(i);
            String field = FIELD_SUBNETS + "[" + i + "]";
            if (!(entry instanceof JSONObject)) {
                throw new InputException("Entry " + i + " of '" + FIELD_SUBNETS + "' must be an object", field);
            }
            JSONObject subnet = (JSONObject) entry;
            JsonValidator.requireFields(subnet, FIELD_ID, FIELD_PLACES, FIELD_TRANSITIONS);
            definitions.add(new SubnetDefinition(
                    JsonArrayReader.getInt(subnet, FIELD_ID),
                    JsonArrayReader.getIntArray(subnet, FIELD_PLACES),
                    JsonArrayReader.getIntArray(subnet, FIELD_TRANSITIONS)));
        }
        return definitions;
    }

    @SuppressWarnings("unchecked")
    public String toJson(NetInput input) {
        PetriNet net = input.getNet();
        JSONObject root = new JSONObject();
        root.put(FIELD_M0, JsonArrayReader.toJsonArray(net.getInitialMarking().toArray()));
        root.put(FIELD_I_MINUS, JsonArrayReader.toJsonMatrix(net.getConsumption()));
        root.put(FIELD_I_PLUS, JsonArrayReader.toJsonMatrix(net.getProduction()));
        if (input.hasSubnetDefinitions()) {
            JSONArray subnets = new JSONArray();
            for (SubnetDefinition definition : input.getSubnetDefinitions()) {
                JSONObject subnet = new JSONObject();
                subnet.put(FIELD_ID, Long.valueOf(definition.id));
                subnet.put(FIELD_PLACES, JsonArrayReader.toJsonArray(definition.getPlaceIndices()));
                subnet.put(FIELD_TRANSITIONS, JsonArrayReader.toJsonArray(definition.getTransitionIndices()));
                subnets.add(subnet);
            }
            root.put(FIELD_SUBNETS, subnets);
        }
        return root.toJSONString();
    }
}
