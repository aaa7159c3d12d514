package com.rlang.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.rlang.debug.ConsoleDebugSink;
import com.rlang.debug.Debug;
import com.rlang.debug.DebugLevel;
import com.rlang.script.parser.CallFrame;
import com.rlang.script.parser.Environment;
import com.rlang.script.parser.EvalError;
import com.rlang.script.parser.ParseError;
import com.rlang.script.parser.RunResult;
import com.rlang.script.parser.utils.EnvironmentJson;

public final class RlangCli {

    static final int EXIT_OK = 0;
    static final int EXIT_EVAL_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_READ_FAILED = 3;
    static final int EXIT_PARSE_ERROR = 65;

    private static final String USAGE = "Usage: RlangCli [--verbose] [--dump-globals] [script-file]";

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        boolean dumpGlobals = false;
        String scriptFile = null;

        for (String a : args) {
            if ("--verbose".equals(a)) {
                Debug.get().setSink(new ConsoleDebugSink(err, DebugLevel.DEBUG));
            } else if ("--dump-globals".equals(a)) {
                dumpGlobals = true;
            } else if (a.startsWith("--") || scriptFile != null) {
                err.println(USAGE);
                return EXIT_USAGE;
            } else {
                scriptFile = a;
            }
        }

        RlangScript engine = new RlangScript();
        engine.setOutput(out::println);

        if (scriptFile == null) {
            return repl(engine, in, out, err);
        }

        final Path scriptPath = Path.of(scriptFile);
        final String script;
        try {
            script = Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to read script file: " + scriptPath);
            Debug.get().e("rlang.cli", "read failed: " + scriptPath, e);
            return EXIT_READ_FAILED;
        }

        Environment globals = engine.createGlobalEnvironment();
        RunResult result;
        try {
            result = engine.run(script, globals);
        } catch (ParseError e) {
            err.println("Error: " + e.getMessage());
            return EXIT_PARSE_ERROR;
        }

        if (!result.isOk()) {
            printError(result.error(), err);
            return EXIT_EVAL_ERROR;
        }
        if (dumpGlobals) {
            out.println(EnvironmentJson.dump(globals));
        }
        return EXIT_OK;
    }

    /** Line-at-a-time prompt sharing one global scope across lines. */
    static int repl(RlangScript engine, InputStream in, PrintStream out, PrintStream err) {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        Environment globals = engine.createGlobalEnvironment();

        while (true) {
            out.print("> ");
            out.flush();

            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                err.println("Failed to read input: " + e.getMessage());
                return EXIT_READ_FAILED;
            }
            if (line == null) return EXIT_OK;

            String cmd = line.trim().toLowerCase();
            if (cmd.equals("exit") || cmd.equals("quit") || cmd.equals("q")) return EXIT_OK;
            if (cmd.equals("help")) {
                out.println("Enter rlang statements, e.g. var x = 1; print x;  (exit | quit | q to leave)");
                continue;
            }
            if (cmd.isEmpty()) continue;

            try {
                RunResult result = engine.run(line, globals);
                if (!result.isOk()) printError(result.error(), err);
            } catch (ParseError e) {
                err.println("Error: " + e.getMessage());
            }
        }
    }

    private static void printError(EvalError error, PrintStream err) {
        err.println("Error: " + error.getMessage());
        for (CallFrame frame : error.callTrace()) {
            err.println("    at " + frame);
        }
    }

    private RlangCli() {}
}
