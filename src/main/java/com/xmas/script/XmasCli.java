package com.xmas.script;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;

import com.xmas.debug.Debug;
import com.xmas.debug.DebugSink;
import com.xmas.debug.StderrDebugSink;
import com.xmas.script.parser.Value;
import com.xmas.script.parser.XmasRuntimeException;
import com.xmas.script.parser.XmasSyntaxException;

/**
 * Usage: {@code xmas [program.xmas] [-i|--input input.txt] [-d|--debug] [--json]}
 *
 * Reads the program from the file, or from stdin when none is given, and prints
 * the final value. An empty array result prints nothing.
 */
public final class XmasCli {

    private static final String USAGE =
            "Usage: xmas [program.xmas] [-i|--input <file>] [-d|--debug] [--json]";

    public static void main(String[] args) {
        int code = run(args, System.in, System.out, System.err);
        if (code != 0) System.exit(code);
    }

    /** @return the process exit code */
    public static int run(String[] args, InputStream stdin, PrintStream out, PrintStream err) {
        String programFile = null;
        String inputFile = null;
        boolean debug = false;
        boolean json = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-i":
                case "--input":
                    if (i + 1 >= args.length) {
                        err.println("Missing value for " + arg);
                        err.println(USAGE);
                        return 2;
                    }
                    inputFile = args[++i];
                    break;
                case "-d":
                case "--debug":
                    debug = true;
                    break;
                case "--json":
                    json = true;
                    break;
                case "-h":
                case "--help":
                    out.println(USAGE);
                    return 0;
                default:
                    if (arg.startsWith("-") || programFile != null) {
                        err.println("Unexpected argument: " + arg);
                        err.println(USAGE);
                        return 2;
                    }
                    programFile = arg;
            }
        }

        final String source;
        try {
            source = programFile != null
                    ? Files.readString(Path.of(programFile), StandardCharsets.UTF_8)
                    : new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println(programFile != null
                    ? "Error reading file '" + programFile + "': " + e.getMessage()
                    : "Error reading from stdin: " + e.getMessage());
            return 1;
        }

        String input = null;
        if (inputFile != null) {
            try {
                input = Files.readString(Path.of(inputFile), StandardCharsets.UTF_8);
            } catch (IOException e) {
                err.println("Warning: Could not read input file '" + inputFile + "': " + e.getMessage());
            }
        }

        XmasScript engine = new XmasScript();
        engine.setDebug(debug);

        DebugSink previousSink = Debug.get().getSink();
        if (debug) Debug.get().setSink(new StderrDebugSink(err));
        try {
            Value result = engine.run(source, input);
            if (json) {
                out.println(ValueJson.toJson(result));
            } else if (!result.isEmptyArray()) {
                out.println(result);
            }
            return 0;
        } catch (XmasSyntaxException e) {
            err.println(e.getMessage());
            return 1;
        } catch (XmasRuntimeException e) {
            err.println("Runtime error: " + e.getMessage());
            return 1;
        } catch (JsonProcessingException e) {
            err.println("Failed to render result as JSON: " + e.getMessage());
            return 1;
        } finally {
            Debug.get().setSink(previousSink);
        }
    }

    private XmasCli() {}
}
