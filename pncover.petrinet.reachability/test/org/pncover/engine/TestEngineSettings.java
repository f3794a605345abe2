package org.pncover.engine;

import java.io.File;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.pncover.exceptions.InputException;
import org.pncover.utils.StringFileIO;

public class TestEngineSettings {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void classpathSettingsMatchDefaults() throws Exception {
        EngineSettings settings = EngineSettings.load();
        Assert.assertEquals(DispatchPolicy.ALL_SUBNETS, settings.getDispatchPolicy());
        Assert.assertEquals("ω", settings.getOmegaSymbol());
        Assert.assertEquals("m_", settings.getNodePrefix());
        Assert.assertEquals("t", settings.getTransitionPrefix());
        Assert.assertTrue(settings.isIncludeRevisitEdges());
        Assert.assertFalse(settings.isRecordEventHistory());
    }

    @Test
    public void missingKeysKeepDefaults() throws Exception {
        EngineSettings settings = EngineSettings.fromXml("<ReachabilitySettings><EngineSettings>"
                + "<dispatchPolicy>owners_only</dispatchPolicy><omegaSymbol>inf</omegaSymbol>"
                + "<includeRevisitEdges>FALSE</includeRevisitEdges></EngineSettings></ReachabilitySettings>");
        Assert.assertEquals(DispatchPolicy.OWNERS_ONLY, settings.getDispatchPolicy());
        Assert.assertEquals("inf", settings.getOmegaSymbol());
        Assert.assertFalse(settings.isIncludeRevisitEdges());
        Assert.assertEquals("m_", settings.getNodePrefix());
    }

    @Test
    public void loadsFromFile() throws Exception {
        File file = folder.newFile("settings.xml");
        StringFileIO.writeStringToFile("<ReachabilitySettings><EngineSettings>"
                + "<recordEventHistory>true</recordEventHistory></EngineSettings></ReachabilitySettings>", file.getPath());
        Assert.assertTrue(EngineSettings.loadFile(file.getPath()).isRecordEventHistory());
    }

    @Test
    public void rejectsBadValues() {
        assertRejected("<dispatchPolicy>SOME</dispatchPolicy>", "dispatchPolicy");
        assertRejected("<includeRevisitEdges>yes</includeRevisitEdges>", "includeRevisitEdges");
    }

    @Test(expected = InputException.class)
    public void rejectsMalformedXml() throws Exception {
        EngineSettings.fromXml("<ReachabilitySettings><EngineSettings>");
    }

    @Test(expected = InputException.class)
    public void missingFileIsInputError() throws Exception {
        EngineSettings.loadFile(new File(folder.getRoot(), "absent.xml").getPath());
    }

    @Test
    public void withersKeepOtherValues() {
        EngineSettings settings = EngineSettings.defaults().withDispatchPolicy(DispatchPolicy.OWNERS_ONLY)
                .withEventHistory(true);
        Assert.assertEquals(DispatchPolicy.OWNERS_ONLY, settings.getDispatchPolicy());
        Assert.assertTrue(settings.isRecordEventHistory());
        Assert.assertEquals("ω", settings.getOmegaSymbol());
    }

    private static void assertRejected(String element, String field) {
        try {
            EngineSettings.fromXml("<ReachabilitySettings><EngineSettings>" + element
                    + "</EngineSettings></ReachabilitySettings>");
            Assert.fail(field + " accepted");
        } catch (InputException e) {
            Assert.assertEquals(field, e.getField());
        }
    }
}
