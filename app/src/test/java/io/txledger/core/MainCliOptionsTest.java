package io.txledger.core;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainCliOptionsTest {

    @Test
    void parsesDefaults() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--genesis=genesis.json"});
        assertFalse(options.showHelp());
        assertNull(options.errorMessage());
        assertEquals(Path.of("genesis.json"), options.genesis());
        assertFalse(options.enableApi());
        assertEquals(300, options.txKeepAliveSeconds());
        assertEquals(8080, options.apiPort());
    }

    @Test
    void enablesApiWithToken() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {
                "--genesis=/etc/txledger/genesis.json",
                "--data-dir=/var/lib/txledger",
                "--enable-api",
                "--api-bind=0.0.0.0",
                "--api-port=8181",
                "--api-token=test-api",
                "--tx-keep-alive=120"
        });
        assertFalse(options.showHelp());
        assertTrue(options.enableApi());
        assertTrue(options.keepAlive());
        assertEquals(Path.of("/var/lib/txledger"), options.dataDir());
        assertEquals("0.0.0.0", options.apiBind());
        assertEquals(8181, options.apiPort());
        assertEquals("test-api", options.apiToken());
        assertEquals(120, options.txKeepAliveSeconds());
    }

    @Test
    void invalidPortSetsError() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--genesis=g.json", "--api-port=70000"});
        assertTrue(options.showHelp());
        assertNotNull(options.errorMessage());
        assertTrue(options.errorMessage().contains("--api-port"));
    }

    @Test
    void negativeKeepAliveSetsError() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--genesis=g.json", "--tx-keep-alive=-1"});
        assertTrue(options.showHelp());
        assertTrue(options.errorMessage().contains("--tx-keep-alive"));
    }

    @Test
    void unknownFlagTriggersHelp() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--genesis=g.json", "--unknown-flag"});
        assertTrue(options.showHelp());
        assertEquals("Unknown option: --unknown-flag", options.errorMessage());
    }

    @Test
    void helpFlagShowsHelpWithoutError() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--help"});
        assertTrue(options.showHelp());
        assertNull(options.errorMessage());
    }
}
