package org.janelia.lorenzcxr.cmd;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.beust.jcommander.Parameter;

import org.apache.commons.lang3.StringUtils;

class AbstractCmdArgs {

    final CommonArgs commonArgs;

    @Parameter(names = {"--inputs", "-i"}, required = true, variableArity = true,
            description = "Input images or directories containing images")
    List<String> inputs = new ArrayList<>();

    @Parameter(names = {"--outputDir", "-od"}, required = true, description = "Output directory")
    String outputDir;

    @Parameter(names = "--width", description = "Working image width; 0 keeps the original width")
    Integer width;

    @Parameter(names = "--height", description = "Working image height; 0 keeps the original height")
    Integer height;

    AbstractCmdArgs(CommonArgs commonArgs) {
        this.commonArgs = commonArgs;
    }

    String getConfigFileName() {
        return commonArgs.configFileName;
    }

    Optional<Path> getOutputDirArg() {
        if (StringUtils.isBlank(outputDir)) {
            return Optional.empty();
        } else {
            return Optional.of(Paths.get(outputDir));
        }
    }

    List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (width != null && width < 0) {
            errors.add("Invalid width: " + width);
        }
        if (height != null && height < 0) {
            errors.add("Invalid height: " + height);
        }
        return errors;
    }
}
