package com.viffx.Pda;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.stringparsers.FileStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;
import com.viffx.Pda.Automata.PdaSimulator;
import com.viffx.Pda.Diagram.DiagramModel;
import com.viffx.Pda.Diagram.Edge;
import com.viffx.Pda.Rules.RuleParser;
import com.viffx.Pda.Validator.PdaValidator;
import com.viffx.Pda.Validator.Submission;
import com.viffx.Pda.Validator.Verdict;
import org.json.JSONObject;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.util.Iterator;

public class Main {
    public static final int EXIT_VERDICT = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_ERROR = 2;

    public static void main(String[] args) throws Exception {
        System.exit(run(args, System.out, System.err));
    }

    public static int run(String[] argv, PrintStream out, PrintStream err) throws JSAPException {
        JSAP jsap = new JSAP();
        JSAPResult config = processParameters(jsap, argv);

        if (config.getBoolean("help")) {
            out.println("Usage: pda-validator " + jsap.getUsage());
            out.println();
            out.println(jsap.getHelp());
            return EXIT_VERDICT;
        }
        if (!config.success()) {
            for (Iterator<?> errs = config.getErrorMessageIterator(); errs.hasNext(); ) {
                err.println("Error: " + errs.next());
            }
            err.println("Usage: pda-validator " + jsap.getUsage());
            return EXIT_USAGE;
        }

        // 1) read the rule file
        File rules = config.getFile("rules");
        String ruleText;
        try {
            Charset charset = Charset.forName(config.getString("encoding"));
            ruleText = RuleParser.read(rules.toPath(), charset);
        } catch (IllegalArgumentException e) {
            err.println("Unsupported encoding: " + config.getString("encoding"));
            return EXIT_USAGE;
        } catch (IOException e) {
            err.println("Cannot read rule file " + rules + ": " + e.getMessage());
            return EXIT_USAGE;
        }

        // 2) parse and simulate
        PdaSimulator simulator = config.getBoolean("trace") ? new PdaSimulator(err) : new PdaSimulator();
        Submission submission = new Submission(ruleText, config.getString("input", ""));
        Verdict verdict = new PdaValidator(simulator).check(submission);

        // 3) report
        boolean diagram = config.getBoolean("diagram") && !verdict.isError();
        if (config.getBoolean("json")) {
            JSONObject json = verdict.toJson();
            if (diagram) json.put("diagram", DiagramModel.of(verdict.transitions()).toJson());
            out.println(json.toString());
        } else {
            out.println(verdict.text());
            if (diagram) {
                for (Edge edge : DiagramModel.of(verdict.transitions()).edges()) {
                    out.println("\t" + edge);
                }
            }
        }
        return verdict.isError() ? EXIT_ERROR : EXIT_VERDICT;
    }

    private static JSAPResult processParameters(JSAP jsap, String[] argv) throws JSAPException {
        Switch helpsw = new Switch("help",
                'h',
                "help",
                "print this help message");
        jsap.registerParameter(helpsw);

        FlaggedOption rulesopt = new FlaggedOption("rules",
                FileStringParser.getParser().setMustExist(true).setMustBeFile(true),
                JSAP.NO_DEFAULT,
                true,
                'r',
                "rules",
                "file holding the transition rules, one per line, in the form " +
                "(state,input,stackTop) -> (newState,newStackTop). The automaton starts in q0 " +
                "with Z on the stack.");
        jsap.registerParameter(rulesopt);

        FlaggedOption inputopt = new FlaggedOption("input",
                StringStringParser.getParser(),
                JSAP.NO_DEFAULT,
                false,
                'i',
                "input",
                "the string to test. Omit to test the empty string.");
        jsap.registerParameter(inputopt);

        FlaggedOption encodingopt = new FlaggedOption("encoding",
                StringStringParser.getParser(),
                "utf-8",
                true,
                'e',
                "encoding",
                "encoding of the rule file, if other than utf-8");
        jsap.registerParameter(encodingopt);

        Switch jsonsw = new Switch("json",
                'j',
                "json",
                "print the verdict as a JSON object");
        jsap.registerParameter(jsonsw);

        Switch tracesw = new Switch("trace",
                't',
                "trace",
                "print every fired rule to stderr");
        jsap.registerParameter(tracesw);

        Switch diagramsw = new Switch("diagram",
                'd',
                "diagram",
                "also print the diagram layout of the parsed rules");
        jsap.registerParameter(diagramsw);

        return jsap.parse(argv);
    }
}
