package org.janelia.lorenzcxr.cmd;

import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point for enhancing chest radiographs.
 */
public class LorenzCXRTool {

    private static final Logger LOG = LoggerFactory.getLogger(LorenzCXRTool.class);

    public static void main(String[] argv) {
        System.exit(run(argv));
    }

    /**
     * Parse the arguments and run the selected command.
     *
     * @return process exit status
     */
    static int run(String... argv) {
        CommonArgs commonArgs = new CommonArgs();
        List<AbstractCmd> cmds = Arrays.asList(
                new EnhanceCXRImagesCmd("enhance", commonArgs),
                new SolidifyMasksCmd("solidify", commonArgs)
        );
        JCommander.Builder cmdlineBuilder = JCommander.newBuilder()
                .addObject(commonArgs);
        cmds.forEach(cmd -> cmdlineBuilder.addCommand(cmd.getCommandName(), cmd.getArgs()));
        JCommander cmdline = cmdlineBuilder.build();
        cmdline.setProgramName(LorenzCXRTool.class.getSimpleName());

        try {
            cmdline.parse(argv);
        } catch (ParameterException e) {
            LOG.error("Invalid arguments: {}", e.getMessage());
            usage(cmdline, e.getJCommander() != null ? e.getJCommander().getParsedCommand() : null);
            return 1;
        }
        String parsedCommand = cmdline.getParsedCommand();
        if (commonArgs.displayHelpMessage) {
            usage(cmdline, parsedCommand);
            return 0;
        }
        if (StringUtils.isBlank(parsedCommand)) {
            LOG.error("No command specified");
            usage(cmdline, null);
            return 1;
        }
        AbstractCmd cmd = cmds.stream()
                .filter(c -> c.matches(parsedCommand))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Unsupported command " + parsedCommand));
        List<String> validationErrors = cmd.getArgs().validate();
        if (!validationErrors.isEmpty()) {
            LOG.error("Invalid {} arguments: {}", parsedCommand, validationErrors);
            usage(cmdline, parsedCommand);
            return 1;
        }
        try {
            cmd.execute();
            return 0;
        } catch (IllegalArgumentException e) {
            // covers invalid enhancement parameters read from the configuration
            LOG.error("Invalid {} configuration: {}", parsedCommand, e.getMessage());
            return 1;
        } catch (UncheckedIOException e) {
            LOG.error("Error running {}", parsedCommand, e);
            return 1;
        }
    }

    private static void usage(JCommander cmdline, String command) {
        StringBuilder sb = new StringBuilder();
        if (StringUtils.isNotBlank(command) && cmdline.getCommands().containsKey(command)) {
            cmdline.getUsageFormatter().usage(command, sb);
        } else {
            cmdline.getUsageFormatter().usage(sb);
        }
        cmdline.getConsole().println(sb.toString());
    }
}
