package io.llmgate.cli;

import picocli.CommandLine.Command;

@Command(name = "llmgate", mixinStandardHelpOptions = true, description = "LLM call gateway: routing, deadlines and fallback")
public final class LlmGateCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
