package org.janelia.lorenzcxr.cmd;

import com.beust.jcommander.Parameter;

class CommonArgs {
    @Parameter(names = "--config", description = "Configuration file; its properties override the default ones")
    String configFileName;

    @Parameter(names = {"--taskConcurrency", "-tc"},
            description = "Number of images processed concurrently; if not set it uses all but one of the available processors")
    int taskConcurrency = 0;

    @Parameter(names = {"-h", "--help"}, description = "Display the help message", help = true, arity = 0)
    boolean displayHelpMessage = false;
}
