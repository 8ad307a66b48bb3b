package dev.epwbatch.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
        name = "epw-batch",
        description = "Batch conversion of weather station records into EPW files, with a persistent result cache.",
        mixinStandardHelpOptions = true,
        version = "epw-batch 1.0.0",
        subcommands = {GenerateCommand.class, CacheCommand.class})
public class EpwBatchCommand implements Runnable {
    static final int EXIT_OK = 0;
    static final int EXIT_ALL_FAILED = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    public static CommandLine newCommandLine() {
        return new CommandLine(new EpwBatchCommand());
    }

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }
}
