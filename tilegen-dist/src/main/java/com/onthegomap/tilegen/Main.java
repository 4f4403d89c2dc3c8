package com.onthegomap.tilegen;

import static java.util.Map.entry;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;

/**
 * Main entry-point for the executable jar, which delegates to the runnable classes in tilegen-core based on an optional
 * first task argument.
 */
public class Main {

  private static final EntryPoint DEFAULT_TASK = TileGenerator::execute;
  private static final Map<String, EntryPoint> ENTRY_POINTS = Map.ofEntries(
    entry("generate", TileGenerator::execute),
    entry("plan", TileGenerator::executePlan)
  );

  public static void main(String[] args) {
    System.exit(execute(args));
  }

  /** Runs the task named by {@code args[0]}, or {@code generate} if it is not a task name, and returns its exit code. */
  static int execute(String... args) {
    EntryPoint task = DEFAULT_TASK;
    if (args.length > 0) {
      String maybeTask = args[0].trim().toLowerCase(Locale.ROOT);
      EntryPoint taskFromArg0 = ENTRY_POINTS.get(maybeTask);
      if (taskFromArg0 != null) {
        args = Arrays.copyOfRange(args, 1, args.length);
        task = taskFromArg0;
      } else if (!maybeTask.contains("=") && !maybeTask.startsWith("-")) {
        System.err.println("Unrecognized task: " + maybeTask);
        System.err.println("possibilities: " + ENTRY_POINTS.keySet());
        return 1;
      }
    }
    return task.run(args);
  }

  @FunctionalInterface
  private interface EntryPoint {

    int run(String... args);
  }
}
