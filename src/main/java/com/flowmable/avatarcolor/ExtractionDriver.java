package com.flowmable.avatarcolor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * CLI driver that extracts colors from avatar images and prints one line per file.
 * <p>
 * Usage: {@code ExtractionDriver [--mode=single|dual] [--fast] <image-or-dir>...}
 * <p>
 * Directories are scanned (non-recursively) for PNG, JPEG, GIF and WEBP files.
 * Exit code is 1 if any file could not be decoded.
 */
public class ExtractionDriver {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionDriver.class);

    private static final List<String> IMAGE_EXTENSIONS = List.of(".png", ".jpg", ".jpeg", ".gif", ".webp");

    record Options(ExtractionMode mode, boolean fast, List<Path> inputs) {}

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        Options options;
        try {
            options = parse(args);
        } catch (IllegalArgumentException e) {
            out.println("Error: " + e.getMessage());
            out.println("Usage: ExtractionDriver [--mode=single|dual] [--fast] <image-or-dir>...");
            return 2;
        }

        List<Path> files;
        try {
            files = findImageFiles(options.inputs());
        } catch (IOException e) {
            logger.warn("Failed to list inputs: {}", e.getMessage(), e);
            out.println("Error: " + e.getMessage());
            return 1;
        }
        if (files.isEmpty()) {
            out.println("No images found.");
            return 0;
        }

        logger.info("Extracting {} colors from {} file(s){}", options.mode(), files.size(), options.fast() ? " (fast)" : "");
        AvatarColorExtractor extractor = new AvatarColorExtractor();
        int failures = 0;
        for (Path file : files) {
            try {
                ExtractionResult result = options.fast()
                        ? extractor.extractFast(AvatarColorExtractor.decode(Files.readAllBytes(file)), options.mode())
                        : extractor.extract(file, options.mode());
                out.println(format(file, result));
            } catch (IOException e) {
                failures++;
                logger.warn("Skipping {}: {}", file, e.getMessage());
                out.printf(Locale.ROOT, "%s\tERROR\t%s%n", file.getFileName(), e.getMessage());
            }
        }
        return failures > 0 ? 1 : 0;
    }

    static Options parse(String[] args) {
        ExtractionMode mode = ExtractionMode.DUAL;
        boolean fast = false;
        List<Path> inputs = new ArrayList<>();
        for (String arg : args) {
            if (arg.startsWith("--mode=")) {
                mode = ExtractionMode.fromFlag(arg.substring("--mode=".length()));
            } else if (arg.equals("--fast")) {
                fast = true;
            } else if (arg.startsWith("--")) {
                throw new IllegalArgumentException("Unknown option: " + arg);
            } else {
                inputs.add(Path.of(arg));
            }
        }
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("No input files given");
        }
        return new Options(mode, fast, List.copyOf(inputs));
    }

    static String format(Path file, ExtractionResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append(file.getFileName()).append('\t').append(result.primaryHex());
        if (result.mode() == ExtractionMode.DUAL) {
            sb.append('\t').append(result.secondaryHex());
        }
        sb.append('\t').append(result.source().name().toLowerCase(Locale.ROOT));
        return sb.toString();
    }

    private static List<Path> findImageFiles(List<Path> inputs) throws IOException {
        List<Path> files = new ArrayList<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                try (Stream<Path> stream = Files.list(input)) {
                    stream.filter(Files::isRegularFile)
                            .filter(ExtractionDriver::isImageFile)
                            .sorted()
                            .forEach(files::add);
                }
            } else if (Files.isRegularFile(input)) {
                files.add(input);
            } else {
                throw new IOException("No such file or directory: " + input);
            }
        }
        return files;
    }

    private static boolean isImageFile(Path p) {
        String n = p.getFileName().toString().toLowerCase(Locale.ROOT);
        return IMAGE_EXTENSIONS.stream().anyMatch(n::endsWith);
    }
}
