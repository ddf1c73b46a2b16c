package sce.exec;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class CommandLineOptionSetTest {

    @Test
    void registeredOptionsKeepValues() {
        CommandLineOptionSet options = new CommandLineOptionSet();
        options.add(CommandLineOptionSet.TRANSFORM, "prefix", "param", "p",
                    "Prefix of temporaries");
        options.add("help", "Print this message");

        assertTrue(options.contains("prefix"));
        assertEquals("param", options.getValue("prefix"));
        assertNull(options.getValue("help"));
        assertEquals(CommandLineOptionSet.TRANSFORM, options.getType("prefix"));
        assertEquals(CommandLineOptionSet.UTILITY, options.getType("help"));

        options.setValue("prefix", "arg");
        assertEquals("arg", options.getValue("prefix"));
    }

    @Test
    void unknownOptionsAreIgnored() {
        CommandLineOptionSet options = new CommandLineOptionSet();
        options.setValue("missing", "1");
        assertFalse(options.contains("missing"));
        assertNull(options.getValue("missing"));
        assertEquals(0, options.getType("missing"));
    }

    @Test
    void usageIsGroupedByCategory() {
        CommandLineOptionSet options = new CommandLineOptionSet();
        options.add(CommandLineOptionSet.ANALYSIS, "verify", "Check the IR");
        options.add(CommandLineOptionSet.UTILITY, "verbosity", "0", "N",
                    "Degree of status messages");

        String analysis = options.getUsage(CommandLineOptionSet.ANALYSIS);
        assertTrue(analysis.contains("-verify"));
        assertFalse(analysis.contains("-verbosity"));
        assertTrue(options.getUsage(CommandLineOptionSet.UTILITY)
                   .contains("-verbosity=N"));

        String usage = options.getUsage();
        assertTrue(usage.indexOf("ANALYSIS") < usage.indexOf("UTILITY"));
    }

    @Test
    void dumpWritesOptionLines() {
        CommandLineOptionSet options = new CommandLineOptionSet();
        options.add(CommandLineOptionSet.UTILITY, "verbosity", "1", "N",
                    "Degree of status messages");
        options.add("help", "Print this message");

        String dump = options.dumpOptions();
        assertTrue(dump.contains("\nverbosity=1\n"), dump);
        assertTrue(dump.contains("\nhelp\n"), dump);
        assertTrue(dump.startsWith("#Option: help"), dump);
    }
}
