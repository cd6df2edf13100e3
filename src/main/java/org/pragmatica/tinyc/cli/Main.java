package org.pragmatica.tinyc.cli;

import org.pragmatica.tinyc.TinyC;
import org.pragmatica.tinyc.TinyCConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Command line front end: {@code tinyc <input_file> <output_file>}.
 *
 * <p>Exit status is 0 when the output was written and 1 otherwise. Nothing is
 * written when the source has a lexing or parsing error.
 */
public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int SUCCESS = 0;
    static final int FAILURE = 1;
    static final String USAGE = "Usage: tinyc <input_file> <output_file>";

    private final PrintStream out;
    private final PrintStream err;
    private final TinyCConfig config;

    Main(PrintStream out, PrintStream err, TinyCConfig config) {
        this.out = out;
        this.err = err;
        this.config = config;
    }

    public static void main(String[] args) {
        int status = new Main(System.out, System.err, TinyCConfig.DEFAULT).run(args);
        if (status != SUCCESS) {
            System.exit(status);
        }
    }

    int run(String[] args) {
        if (args.length != 2) {
            err.println(USAGE);
            return FAILURE;
        }

        Path input;
        Path output;
        try {
            input = Path.of(args[0]);
            output = Path.of(args[1]);
        } catch (InvalidPathException e) {
            err.println("Invalid path: " + e.getMessage());
            return FAILURE;
        }

        String source;
        try {
            source = Files.readString(input, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Failed to read {}", input, e);
            err.println("Error reading input file: " + e.getMessage());
            return FAILURE;
        }

        log.info("Compiling {} into {}", input, output);
        try {
            return TinyC.compile(source, config)
                        .fold(error -> {
                                  var diagnostic = error.toDiagnostic();
                                  var fileName = input.getFileName().toString();
                                  log.info("Compilation failed: {}", diagnostic.formatSimple(fileName));
                                  err.print(diagnostic.format(source, fileName));
                                  return FAILURE;
                              },
                              code -> write(output, code));
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return FAILURE;
        }
    }

    private int write(Path output, String code) {
        try {
            Files.writeString(output, code, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Failed to write {}", output, e);
            err.println("Error writing output file: " + e.getMessage());
            return FAILURE;
        }
        log.info("Wrote {} characters to {}", code.length(), output);
        out.println("C code generated and saved to " + output);
        return SUCCESS;
    }
}
