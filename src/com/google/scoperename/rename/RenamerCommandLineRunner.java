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

package com.google.scoperename.rename;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.Files;
import com.google.gson.JsonParseException;
import com.google.scoperename.ast.AstJson;
import com.google.scoperename.ast.Node;
import com.google.scoperename.ast.SourcePrinter;
import com.google.scoperename.rename.RenamingOptions.AliasStyle;
import com.google.scoperename.rename.RenamingOptions.LoopScoping;
import com.google.scoperename.rename.RenamingOptions.Policy;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/**
 * Renames a module read from a JSON tree file.
 *
 * <pre>
 * java -jar scoperename.jar --input module.json --output_format SOURCE --seed 42
 * </pre>
 *
 * <p>Exits with 0 on success, 1 when the tree cannot be renamed, and 2 for bad arguments or an
 * unreadable input.
 */
public final class RenamerCommandLineRunner {

  static final int EXIT_SUCCESS = 0;
  static final int EXIT_RENAMING_ERROR = 1;
  static final int EXIT_USAGE_ERROR = 2;

  /** How the renamed tree is written. */
  enum OutputFormat {
    JSON,
    SOURCE
  }

  private static class Flags {
    @Option(name = "--help", usage = "Displays this message on stdout and exit")
    private boolean displayHelp = false;

    @Option(name = "--input", usage = "The JSON tree of the module to rename", metaVar = "FILE")
    private String input = null;

    @Option(
        name = "--output",
        usage = "Where to write the renamed module. Defaults to stdout",
        metaVar = "FILE")
    private String output = null;

    @Option(name = "--output_format", usage = "JSON (default) or SOURCE")
    private OutputFormat outputFormat = OutputFormat.JSON;

    @Option(
        name = "--policy",
        usage = "FULL (default) renames every binding, SELECTIVE only imports")
    private Policy policy = Policy.FULL;

    @Option(name = "--seed", usage = "Seed for the alias generator. Same seed, same output")
    private Long seed = null;

    @Option(name = "--alias_style", usage = "RANDOM (default) or HASH_SEEDED")
    private AliasStyle aliasStyle = AliasStyle.RANDOM;

    @Option(
        name = "--loop_scoping",
        usage = "ISOLATED (default) gives loop and with bodies their own scope, LEAKING does not")
    private LoopScoping loopScoping = LoopScoping.ISOLATED;

    @Option(name = "--max_nesting_depth", usage = "Maximum number of nested scopes")
    private int maxNestingDepth = 100;

    @Option(
        name = "--alias_map_output",
        usage = "File to write the original:alias pairs to",
        metaVar = "FILE")
    private String aliasMapOutput = null;

    @Option(
        name = "--logging_level",
        usage = "The logging level (standard java.util.logging.Level values) of the renamer")
    private String loggingLevel = Level.WARNING.getName();
  }

  private final Flags flags = new Flags();
  private final CmdLineParser parser = new CmdLineParser(flags);
  private final String[] args;
  private final PrintStream out;
  private final PrintStream err;

  @VisibleForTesting
  RenamerCommandLineRunner(String[] args, PrintStream out, PrintStream err) {
    this.args = args.clone();
    this.out = out;
    this.err = err;
  }

  /** Runs the rename and returns the exit status. */
  int run() {
    try {
      parser.parseArgument(args);
      if (flags.displayHelp) {
        parser.printUsage(out);
        return EXIT_SUCCESS;
      }
      if (flags.input == null) {
        throw new CmdLineException(parser, "--input is required");
      }
      Logger.getLogger("com.google.scoperename").setLevel(Level.parse(flags.loggingLevel));
    } catch (CmdLineException | IllegalArgumentException e) {
      err.println(e.getMessage());
      parser.printUsage(err);
      return EXIT_USAGE_ERROR;
    }

    Node module;
    try {
      module = AstJson.moduleFromJson(Files.asCharSource(new File(flags.input), UTF_8).read());
    } catch (IOException e) {
      err.println("ERROR - " + flags.input + " read error: " + e.getMessage());
      return EXIT_USAGE_ERROR;
    } catch (JsonParseException
        | IllegalStateException
        | UnsupportedOperationException
        | NumberFormatException e) {
      err.println("ERROR - " + flags.input + " is not a valid tree: " + e.getMessage());
      return EXIT_USAGE_ERROR;
    }

    RenameResult result;
    try {
      result = new IdentifierRenamer(createOptions()).rename(module);
    } catch (RenamingOptionsValidator.InvalidOptionsException e) {
      err.println("ERROR - " + e.getMessage());
      return EXIT_USAGE_ERROR;
    } catch (RenamingException e) {
      err.println("ERROR - " + e.getError().format());
      return EXIT_RENAMING_ERROR;
    }

    try {
      writeOutput(result);
    } catch (IOException e) {
      err.println("ERROR - cannot write output: " + e.getMessage());
      return EXIT_USAGE_ERROR;
    }
    return EXIT_SUCCESS;
  }

  @VisibleForTesting
  RenamingOptions createOptions() {
    RenamingOptions options = new RenamingOptions();
    options.setPolicy(flags.policy);
    options.setSeed(flags.seed);
    options.setAliasStyle(flags.aliasStyle);
    options.setLoopScoping(flags.loopScoping);
    options.setMaxNestingDepth(flags.maxNestingDepth);
    return options;
  }

  private void writeOutput(RenameResult result) throws IOException {
    String text =
        switch (flags.outputFormat) {
          case JSON -> AstJson.toPrettyJson(result.getRoot()) + "\n";
          case SOURCE -> SourcePrinter.print(result.getRoot());
        };
    if (flags.output == null) {
      out.print(text);
      out.flush();
    } else {
      Files.asCharSink(new File(flags.output), UTF_8).write(text);
    }
    if (flags.aliasMapOutput != null) {
      result.getAliasMap().save(flags.aliasMapOutput);
    }
  }

  public static void main(String[] args) {
    System.exit(new RenamerCommandLineRunner(args, System.out, System.err).run());
  }
}
