package tech.webextools.cli;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine.Command;

@TopCommand
@Command(name = "webextools", mixinStandardHelpOptions = true, version = "2.1.1",
    description = "Webex administration tools",
    subcommands = {DisableUsersCommand.class, RecordingReportCommand.class})
public class WebexToolsCommand {
}
