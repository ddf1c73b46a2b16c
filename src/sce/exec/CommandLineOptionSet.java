package sce.exec;

import java.util.Map;
import java.util.TreeMap;

import sce.hir.PrintTools;

/**
* Registry of the recognized options: each option has a category, a current
* value (null if unset), an argument hint for the usage text and a usage
* description.
*/
public class CommandLineOptionSet {

    public static final int ANALYSIS = 1;
    public static final int TRANSFORM = 2;
    public static final int UTILITY = 3;

    private static class OptionRecord {

        private final int option_type;

        private String value;

        private final String arg;

        private final String usage;

        private OptionRecord(int type, String value, String arg,
                             String usage) {
            this.option_type = type;
            this.value = value;
            this.arg = arg;
            this.usage = usage;
        }
    }

    private final TreeMap<String, OptionRecord> name_to_record;

    public CommandLineOptionSet() {
        name_to_record = new TreeMap<String, OptionRecord>();
    }

    /** Adds a flag of the utility category. */
    public void add(String name, String usage) {
        add(UTILITY, name, null, null, usage);
    }

    /** Adds a flag without a default value. */
    public void add(int type, String name, String usage) {
        add(type, name, null, null, usage);
    }

    /**
    * Adds an option.
    *
    * @param type the category of the option.
    * @param name the option name, without the leading dash.
    * @param value the default value, or null.
    * @param arg the argument hint shown in the usage, or null for a flag.
    * @param usage the description of the option.
    */
    public void add(int type, String name, String value, String arg,
                    String usage) {
        name_to_record.put(name, new OptionRecord(type, value, arg, usage));
    }

    public boolean contains(String name) {
        return name_to_record.containsKey(name);
    }

    /**
    * Returns the value of the option.
    *
    * @return the value, or null if the option is unset or unknown.
    */
    public String getValue(String name) {
        OptionRecord record = name_to_record.get(name);
        return (record == null) ? null : record.value;
    }

    /**
    * Sets the value of a registered option; unknown names are ignored.
    */
    public void setValue(String name, String value) {
        OptionRecord record = name_to_record.get(name);
        if (record != null) {
            record.value = value;
        }
    }

    /**
    * Returns the category of the option, 0 if it is unknown.
    */
    public int getType(String name) {
        OptionRecord record = name_to_record.get(name);
        return (record == null) ? 0 : record.option_type;
    }

    /**
    * Returns the options with their current values in the format of an
    * options file: a commented usage block followed by {@code name=value}.
    */
    public String dumpOptions() {
        StringBuilder sb = new StringBuilder(1000);
        for (Map.Entry<String, OptionRecord> entry :
                name_to_record.entrySet()) {
            OptionRecord record = entry.getValue();
            sb.append("#Option: ").append(entry.getKey()).append("\n#");
            sb.append(entry.getKey());
            if (record.arg != null) {
                sb.append("=").append(record.arg);
            }
            sb.append("\n#").append(record.usage.replaceAll("\n", "\n#"));
            sb.append("\n").append(entry.getKey());
            if (record.value != null) {
                sb.append("=").append(record.value);
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    /** Returns the usage of all options grouped by category. */
    public String getUsage() {
        StringBuilder sb = new StringBuilder(2000);
        String[] titles = {"ANALYSIS", "TRANSFORM", "UTILITY"};
        int[] types = {ANALYSIS, TRANSFORM, UTILITY};
        for (int i = 0; i < types.length; i++) {
            appendRule(sb);
            sb.append(titles[i]).append(PrintTools.line_sep);
            appendRule(sb);
            sb.append(getUsage(types[i]));
        }
        return sb.toString();
    }

    private static void appendRule(StringBuilder sb) {
        for (int i = 0; i < 80; i++) {
            sb.append("-");
        }
        sb.append(PrintTools.line_sep);
    }

    /** Returns the usage of the options in the category. */
    public String getUsage(int type) {
        StringBuilder sb = new StringBuilder(500);
        for (Map.Entry<String, OptionRecord> entry :
                name_to_record.entrySet()) {
            OptionRecord record = entry.getValue();
            if (record.option_type != type) {
                continue;
            }
            sb.append("-").append(entry.getKey());
            if (record.arg != null) {
                sb.append("=").append(record.arg);
            }
            sb.append("\n    ").append(record.usage).append("\n\n");
        }
        return sb.toString();
    }
}
