package com.initialone.jmtoc;

import com.initialone.jmtoc.commands.*;
import picocli.CommandLine;

@CommandLine.Command(
        name = "jmtoc",
        version = "0.1.0",
        mixinStandardHelpOptions = true,
        usageHelpAutoWidth = true,
        sortOptions = false,
        description = {
                "Render MATLAB classdef files as pseudo-code for doxygen.",
                "  filter: one file, for FILTER_PATTERNS in a Doxyfile",
                "  batch:  whole source trees, with warnings.log",
                "",
                "Config (JSON): { \"group\": ..., \"encoding\": ..., \"macros\": { name: template } }"
        },
        subcommands = { FilterCmd.class, BatchCmd.class }
)
public class Main implements Runnable {
    public void run() { System.out.println("Use a subcommand. Try --help."); }
    public static void main(String[] args) {
        int code = new CommandLine(new Main()).execute(args);
        System.exit(code);
    }
}
