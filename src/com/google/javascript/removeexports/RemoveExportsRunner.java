/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.javascript.removeexports;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.Iterables;
import com.google.common.io.Files;
import com.google.javascript.jscomp.Compiler;
import com.google.javascript.jscomp.CompilerOptions;
import com.google.javascript.jscomp.CompilerOptions.LanguageMode;
import com.google.javascript.jscomp.JSError;
import com.google.javascript.jscomp.SourceFile;
import com.google.javascript.rhino.Node;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.spi.BooleanOptionHandler;

/**
 * Runs {@link RemoveExports} on one ES module from the command line.
 *
 * <pre>
 * java -jar remove-exports.jar --js page.js --remove getStaticProps --js_output_file out.js
 * java -jar remove-exports.jar --js page.js --config '["getServerSideProps", "default"]'
 * </pre>
 *
 * <p>Exits with a non-zero status, writing nothing, if the flags, the configuration or the input
 * are invalid.
 */
public final class RemoveExportsRunner {

  private static final Logger logger = Logger.getLogger(RemoveExportsRunner.class.getName());

  static class Flags {
    @Option(
        name = "--help",
        handler = BooleanOptionHandler.class,
        usage = "Displays this message on stdout and exit")
    private boolean displayHelp = false;

    @Option(name = "--js", usage = "The ES module to remove exports from")
    private String js = "";

    @Option(
        name = "--remove",
        usage = "Name of an export to remove. Use 'default' for the default export. You may"
            + " specify multiple")
    private List<String> remove = new ArrayList<>();

    @Option(
        name = "--config",
        usage = "JSON array of export names to remove, e.g. '[\"getStaticProps\"]'")
    private String config = "";

    @Option(name = "--config_file", usage = "File containing the --config JSON array")
    private String configFile = "";

    @Option(
        name = "--js_output_file",
        usage = "Primary output filename. If not specified, output is written to stdout")
    private String jsOutputFile = "";

    @Option(
        name = "--logging_level",
        usage = "The logging level (standard java.util.logging.Level values) for progress")
    private String loggingLevel = Level.WARNING.getName();

    private final CmdLineParser parser;

    Flags() {
      parser = new CmdLineParser(this);
    }

    private void parse(String[] args) throws CmdLineException {
      parser.parseArgument(args);
      if (!displayHelp && js.isEmpty()) {
        throw new CmdLineException(parser, "Missing required flag --js");
      }
    }

    private void printUsage(PrintStream ps) {
      ps.println("Usage: remove-exports --js <file> [--remove <name>...] [--config <json>]");
      parser.printUsage(ps);
    }
  }

  private final PrintStream out;
  private final PrintStream err;

  RemoveExportsRunner(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }

  /** Runs the tool and returns the process exit status. */
  int run(String[] args) {
    Flags flags = new Flags();
    try {
      flags.parse(args);
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      flags.printUsage(err);
      return -1;
    }
    if (flags.displayHelp) {
      flags.printUsage(out);
      return 0;
    }
    try {
      Logger.getLogger("com.google.javascript.removeexports")
          .setLevel(Level.parse(flags.loggingLevel));
      RemovalTargets targets = readTargets(flags);
      String source = Files.asCharSource(new File(flags.js), UTF_8).read();
      String output = removeExports(flags.js, source, targets);
      if (output == null) {
        return -1;
      }
      if (flags.jsOutputFile.isEmpty()) {
        out.print(output);
      } else {
        Files.asCharSink(new File(flags.jsOutputFile), UTF_8).write(output);
      }
      return 0;
    } catch (IllegalArgumentException | IOException e) {
      err.println("ERROR - " + e.getMessage());
      return -1;
    }
  }

  /** Merges --remove with the JSON configuration. At least one of them must be given. */
  private static RemovalTargets readTargets(Flags flags) throws IOException {
    String config = flags.config;
    if (!flags.configFile.isEmpty()) {
      if (!config.isEmpty()) {
        throw new IllegalArgumentException("--config and --config_file cannot both be specified");
      }
      config = Files.asCharSource(new File(flags.configFile), UTF_8).read();
    }
    if (config.isEmpty()) {
      if (flags.remove.isEmpty()) {
        throw new IllegalArgumentException(
            "failed to get plugin config for remove-exports: specify --remove, --config or"
                + " --config_file");
      }
      return RemovalTargets.copyOf(flags.remove);
    }
    return RemovalTargets.copyOf(
        Iterables.concat(RemovalTargets.fromJson(config).names(), flags.remove));
  }

  /** Returns the module with {@code targets} removed, or null if it does not parse. */
  private @Nullable String removeExports(String fileName, String source, RemovalTargets targets) {
    Compiler compiler = new Compiler(err);
    CompilerOptions options = new CompilerOptions();
    options.setLanguageIn(LanguageMode.ECMASCRIPT_NEXT);
    compiler.initOptions(options);

    Node script = compiler.parse(SourceFile.fromCode(fileName, source));
    if (compiler.getErrorCount() > 0) {
      for (JSError error : compiler.getErrors()) {
        err.println(error);
      }
      return null;
    }
    logger.fine("Parsed " + fileName);
    new RemoveExports(compiler, targets).process(null, script);
    return compiler.toSource(script) + "\n";
  }

  public static void main(String[] args) {
    int status = new RemoveExportsRunner(System.out, System.err).run(args);
    if (status != 0) {
      System.exit(status);
    }
  }
}
