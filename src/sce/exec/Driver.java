package sce.exec;

import java.util.ArrayList;
import java.util.List;

import sce.analysis.AnalysisContext;
import sce.analysis.SliceCriterion;
import sce.analysis.SliceResult;
import sce.analysis.Slicer;
import sce.hir.PrintTools;
import sce.hir.Procedure;
import sce.hir.TranslationUnit;
import sce.transforms.InlineResult;
import sce.transforms.InlineSpec;
import sce.transforms.Inliner;
import sce.transforms.SliceProjection;

/**
* Parses the options and runs slicing and inlining requests on translation
* units built by a front end. Each driver has its own option set; a request
* builds its own analysis state, so requests on different drivers or on the
* same unit may run concurrently.
*/
public class Driver {

    /** A mapping from option names to option values. */
    protected final CommandLineOptionSet options;

    public Driver() {
        options = new CommandLineOptionSet();
        registerOptions();
    }

    /**
    * Registers the legal set of options and their default values. Only
    * registered options can have values set.
    */
    protected void registerOptions() {
        options.add(CommandLineOptionSet.UTILITY, "verbosity", "0", "N",
                "Degree of status messages (0-4) that you wish to see " +
                "(default is 0)");
        options.add(CommandLineOptionSet.UTILITY, "help",
                "Print this message");
        options.add(CommandLineOptionSet.TRANSFORM, "inline-param-prefix",
                "param", "prefix",
                "Prefix of the temporaries bound to the arguments");
        options.add(CommandLineOptionSet.TRANSFORM, "inline-local-prefix",
                "local", "prefix",
                "Prefix of the renamed locals of an inlined function");
        options.add(CommandLineOptionSet.TRANSFORM, "inline-result-prefix",
                "result", "prefix",
                "Prefix of the variable holding the value of an inlined call");
        options.add(CommandLineOptionSet.TRANSFORM, "inline-done-prefix",
                "done", "prefix",
                "Prefix of the flag set by early returns of an inlined " +
                "function");
        options.add(CommandLineOptionSet.TRANSFORM, "inline-max-name-length",
                "256", "N", "Maximum length of the generated names");
        options.add(CommandLineOptionSet.ANALYSIS, "verify",
                "Check the consistency of the IR after each transformation");
    }

    /**
    * Parses {@code -name} and {@code -name=value} options. A flag without a
    * value is set to "1". Parsing stops at the first argument that does not
    * start with a dash.
    *
    * @param args the arguments.
    * @return the arguments after the options.
    * @throws IllegalArgumentException if an option has an invalid value.
    */
    public List<String> parseCommandLine(String[] args) {
        int i;
        for (i = 0; i < args.length; i++) {
            String opt = args[i];
            if (opt.length() < 2 || opt.charAt(0) != '-') {
                break;
            }
            int eq = opt.indexOf('=');
            if (eq == -1) {
                setOption(opt.substring(1), "1");
            } else {
                setOption(opt.substring(1, eq), opt.substring(eq + 1));
            }
        }
        List<String> ret = new ArrayList<String>();
        for (; i < args.length; i++) {
            ret.add(args[i]);
        }
        applyVerbosity();
        if (getOptionValue("help") != null) {
            printUsage();
        }
        return ret;
    }

    /**
    * Parses one line of an options file, {@code name} or {@code name=value},
    * as written by {@link CommandLineOptionSet#dumpOptions}. A name without a
    * value unsets the option. Empty lines and comments are skipped.
    */
    public void parseOption(String opt) {
        opt = opt.trim();
        if (opt.length() < 2 || opt.startsWith("#")) {
            return;
        }
        int eq = opt.indexOf('=');
        if (eq == -1) {
            setOption(opt, null);
        } else {
            setOption(opt.substring(0, eq), opt.substring(eq + 1));
        }
    }

    private void setOption(String name, String value) {
        if (options.contains(name)) {
            setOptionValue(name, value);
        } else {
            PrintTools.printlnStatus(0, "[WARNING] ignoring unrecognized",
                                     "option", name);
        }
    }

    private void applyVerbosity() {
        PrintTools.setVerbosity(getIntOption("verbosity", 0, 4));
    }

    /**
    * Returns the value of an option.
    *
    * @return the value, or null if the option is unset.
    */
    public String getOptionValue(String key) {
        return options.getValue(key);
    }

    public void setOptionValue(String key, String value) {
        options.setValue(key, value);
    }

    public CommandLineOptionSet getOptions() {
        return options;
    }

    private int getIntOption(String key, int min, int max) {
        String value = getOptionValue(key);
        int ret;
        try {
            ret = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "option " + key + " needs a number: " + value, e);
        }
        if (ret < min || ret > max) {
            throw new IllegalArgumentException(
                    "option " + key + " is out of range: " + value);
        }
        return ret;
    }

    /** Prints the list of options that the driver accepts. */
    public void printUsage() {
        String usage = PrintTools.line_sep + "sce.exec.Driver [option]..." +
                PrintTools.line_sep + options.getUsage();
        System.err.println(usage);
    }

    /**
    * Slices a function of the unit.
    *
    * @param unit the translation unit.
    * @param function_name the name of the function holding the criterion.
    * @param criterion the slicing criterion.
    * @return the slice.
    * @throws IllegalArgumentException if the unit does not define the
    *   function.
    */
    public SliceResult slice(TranslationUnit unit, String function_name,
                             SliceCriterion criterion) {
        Procedure proc = unit.findProcedure(function_name);
        if (proc == null || proc.getBody() == null) {
            throw new IllegalArgumentException(
                    "no definition of function " + function_name);
        }
        return new Slicer(AnalysisContext.build(proc)).slice(criterion);
    }

    /**
    * Slices a function and removes the statements outside the slice from a
    * copy of it.
    *
    * @see #slice(TranslationUnit, String, SliceCriterion)
    */
    public SliceProjection project(TranslationUnit unit, String function_name,
                                   SliceCriterion criterion) {
        return new SliceProjection(slice(unit, function_name, criterion));
    }

    /**
    * Inlines the call described by the request into a copy of the unit,
    * with the inlining options of this driver.
    *
    * @see Inliner#inline(TranslationUnit, InlineSpec)
    */
    public InlineResult inline(TranslationUnit unit, InlineSpec spec) {
        return createInliner().inline(unit, spec);
    }

    /**
    * Returns an inliner configured by the current option values.
    */
    protected Inliner createInliner() {
        Inliner ret = new Inliner();
        ret.setParamPrefix(getOptionValue("inline-param-prefix"));
        ret.setLocalPrefix(getOptionValue("inline-local-prefix"));
        ret.setResultPrefix(getOptionValue("inline-result-prefix"));
        ret.setDonePrefix(getOptionValue("inline-done-prefix"));
        ret.setMaxNameLength(
                getIntOption("inline-max-name-length", 16, Integer.MAX_VALUE));
        ret.setVerify(getOptionValue("verify") != null);
        return ret;
    }
}
