package com.dialogchain.generator;

import com.dialogchain.generator.cli.CreateCommand;
import com.dialogchain.generator.cli.TemplatesCommand;
import com.dialogchain.generator.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "dialogchain",
        description = "Generate DialogChain event pipeline projects from built-in templates",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        subcommands = {
                CreateCommand.class,
                TemplatesCommand.class,
                ValidateCommand.class
        }
)
public class DialogChainCli implements Runnable {

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DialogChainCli()).execute(args);
        System.exit(exitCode);
    }
}
