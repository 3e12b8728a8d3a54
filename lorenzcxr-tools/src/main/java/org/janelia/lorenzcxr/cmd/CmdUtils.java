package org.janelia.lorenzcxr.cmd;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CmdUtils {
    private static final Logger LOG = LoggerFactory.getLogger(CmdUtils.class);

    static final String[] IMAGE_EXTENSIONS = {"png", "jpg", "jpeg", "tif", "tiff", "bmp", "gif"};

    static ExecutorService createCmdExecutor(CommonArgs args) {
        int taskConcurrency = getTaskConcurrency(args);
        LOG.info("Create a thread pool with {} worker threads ({} available processors)",
                taskConcurrency, Runtime.getRuntime().availableProcessors());
        return Executors.newFixedThreadPool(
                taskConcurrency,
                new ThreadFactoryBuilder()
                        .setNameFormat("CMDRUNNER-%d")
                        .setDaemon(true)
                        .build());
    }

    static int getTaskConcurrency(CommonArgs args) {
        if (args.taskConcurrency > 0) {
            return args.taskConcurrency;
        } else {
            return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        }
    }

    /**
     * Expand the inputs into the list of image files. Directories are scanned (not recursively)
     * for files with a known image extension; files are kept if they have a known image extension.
     */
    static List<Path> listInputImages(List<String> inputs) {
        return inputs.stream()
                .map(Paths::get)
                .flatMap(inputPath -> {
                    if (Files.isDirectory(inputPath)) {
                        Collection<File> imageFiles = FileUtils.listFiles(inputPath.toFile(), IMAGE_EXTENSIONS, false);
                        return imageFiles.stream().map(File::toPath);
                    } else if (Files.exists(inputPath) && isImageFile(inputPath)) {
                        return Stream.of(inputPath);
                    } else {
                        LOG.warn("Input {} does not exist or it is not an image file", inputPath);
                        return Stream.empty();
                    }
                })
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * Assign every input image the name used for its outputs. The name is the image base name
     * unless several inputs share it, for example "a/cxr.png" and "b/cxr.jpg", in which case
     * each of them gets a numeric suffix that does not clash with any other output name.
     *
     * @return output names in the order of the inputs
     */
    static Map<Path, String> getOutputNames(List<Path> inputImages) {
        Map<String, List<Path>> inputsByBaseName = inputImages.stream()
                .collect(Collectors.groupingBy(
                        p -> FilenameUtils.getBaseName(p.getFileName().toString()),
                        LinkedHashMap::new,
                        Collectors.toList()));
        Set<String> usedNames = new HashSet<>();
        inputsByBaseName.forEach((baseName, inputs) -> {
            if (inputs.size() == 1) {
                usedNames.add(baseName);
            }
        });
        Map<Path, String> outputNames = new LinkedHashMap<>();
        inputsByBaseName.forEach((baseName, inputs) -> {
            if (inputs.size() == 1) {
                outputNames.put(inputs.get(0), baseName);
            } else {
                int suffix = 1;
                for (Path input : inputs) {
                    while (usedNames.contains(baseName + "_" + suffix)) {
                        suffix++;
                    }
                    String outputName = baseName + "_" + suffix;
                    usedNames.add(outputName);
                    outputNames.put(input, outputName);
                    LOG.info("{} shares its name with other inputs - its outputs are named {}", input, outputName);
                }
            }
        });
        Map<Path, String> orderedOutputNames = new LinkedHashMap<>();
        inputImages.forEach(input -> orderedOutputNames.put(input, outputNames.get(input)));
        return orderedOutputNames;
    }

    private static boolean isImageFile(Path p) {
        return FilenameUtils.isExtension(p.getFileName().toString().toLowerCase(), IMAGE_EXTENSIONS);
    }

    static void createDirs(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Error creating " + dir, e);
        }
    }
}
