package com.largomodo.zipbundle;

import com.largomodo.zipbundle.core.ArchiveOptions;
import com.largomodo.zipbundle.core.BundleProcessor;
import com.largomodo.zipbundle.core.EmptyArchivePolicy;
import com.largomodo.zipbundle.core.GenerationBundler;
import com.largomodo.zipbundle.core.PayloadReader;
import com.largomodo.zipbundle.core.TimestampPolicy;
import com.largomodo.zipbundle.core.Utf8FlagPolicy;
import com.largomodo.zipbundle.core.domain.Archive;
import com.largomodo.zipbundle.core.domain.BundleFile;
import com.largomodo.zipbundle.core.domain.GeneratedImage;
import com.largomodo.zipbundle.service.ArchiveWriter;
import com.largomodo.zipbundle.service.zip.StoredZipWriter;
import com.largomodo.zipbundle.util.EntryNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point for bundling files into a single ZIP archive.
 * <p>
 * Uses Picocli framework for argument parsing with automatic help generation
 * and type-safe validation. Two layouts are supported:
 * - Plain: every input file (or every file below an input directory) becomes one entry
 * - Generation (--result-id): original.png followed by numbered perspective images,
 *   written as ai-generated-&lt;id&gt;.zip
 */
@Command(
        name = "zipbundle",
        mixinStandardHelpOptions = true,
        resourceBundle = "zipbundle.zipbundle",
        version = "${bundle:application.version}",
        header = "Bundles files into a single ZIP archive.",
        description = {
                "Packs files and directory trees into one store-only ZIP archive that any standard " +
                        "extractor can open.",
                "",
                "Inputs may be raw files or base64 text / data URLs (--base64). With --result-id the " +
                        "inputs are treated as generated views of --original and laid out as a download bundle."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:General execution error (I/O, archive limits, etc.)",
                "2:Invalid command line arguments"
        }
)
public class ZipBundle implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ZipBundle.class);
    static final String DEFAULT_OUTPUT = "bundle.zip";

    @Parameters(index = "0..*", arity = "1..*", paramLabel = "INPUT",
            description = {
                    "Files or directories to bundle, in archive order.",
                    "Directories are walked recursively; entries keep the directory name as prefix."
            })
    List<File> inputs;

    @Option(names = {"-o", "--output"},
            description = {
                    "Archive file to write. Replaced if it exists.",
                    "Default: " + DEFAULT_OUTPUT + ", or ai-generated-<id>.zip with --result-id."
            })
    File output;

    @Option(names = "--base64",
            description = "Inputs hold base64 text or data URLs; decode them and drop a .b64/.base64 suffix.")
    boolean base64;

    @Option(names = "--timestamp", defaultValue = "FIXED",
            description = {
                    "Modification time written to entries.",
                    "Valid values: ${COMPLETION-CANDIDATES}",
                    "Default: ${DEFAULT-VALUE} (1980-01-01, reproducible output)"
            })
    TimestampPolicy timestamp;

    @Option(names = "--utf8-flag", defaultValue = "AUTO",
            description = {
                    "When to mark entry names as UTF-8.",
                    "Valid values: ${COMPLETION-CANDIDATES}",
                    "Default: ${DEFAULT-VALUE}"
            })
    Utf8FlagPolicy utf8Flag;

    @Option(names = "--empty", defaultValue = "PERMIT",
            description = {
                    "What to do when no entries were collected.",
                    "Valid values: ${COMPLETION-CANDIDATES}",
                    "Default: ${DEFAULT-VALUE}"
            })
    EmptyArchivePolicy emptyPolicy;

    @Option(names = "--result-id",
            description = "Generation result id. Enables the generation layout (requires --original).")
    String resultId;

    @Option(names = "--original",
            description = "Original image of the generation result, stored as original.png.")
    File original;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    private Clock clock = Clock.systemDefaultZone();

    public static void main(String[] args) {
        int exitCode = commandLine(new ZipBundle()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Configure the command line the same way for production and tests: case-insensitive enum
     * values, and execution failures reported through the log instead of a raw stack trace.
     */
    static CommandLine commandLine(ZipBundle app) {
        CommandLine cmd = new CommandLine(app);
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            log.error("FAILED: {}", ex.getMessage());
            log.debug("Failure details", ex);
            return commandLine.getCommandSpec().exitCodeOnExecutionException();
        });
        return cmd;
    }

    /**
     * Override the clock used by --timestamp NOW (tests).
     */
    void setClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        for (File input : inputs) {
            if (!input.exists()) {
                throw new ParameterException(spec.commandLine(),
                        "Input path does not exist: " + input.getAbsolutePath());
            }
            if (!input.canRead()) {
                throw new ParameterException(spec.commandLine(),
                        "Input path is not readable (check permissions): " + input.getAbsolutePath());
            }
        }

        boolean generationLayout = resultId != null;
        if (generationLayout && original == null) {
            throw new ParameterException(spec.commandLine(), "--result-id requires --original");
        }
        if (!generationLayout && original != null) {
            throw new ParameterException(spec.commandLine(), "--original is only used together with --result-id");
        }
        if (generationLayout && resultId.isBlank()) {
            throw new ParameterException(spec.commandLine(), "--result-id must not be blank");
        }

        if (output == null) {
            output = new File(generationLayout ? GenerationBundler.fileNameFor(resultId) : DEFAULT_OUTPUT);
        }
        if (output.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Output path must be a file, not a directory: " + output.getAbsolutePath());
        }

        ArchiveOptions options = new ArchiveOptions(timestamp.resolve(clock), utf8Flag, emptyPolicy);
        ArchiveWriter writer = new StoredZipWriter(options);
        BundleProcessor processor = new BundleProcessor(writer);
        PayloadReader reader = base64 ? PayloadReader.BASE64 : PayloadReader.RAW;

        try {
            MDC.put("bundle", output.getName());
            if (generationLayout) {
                runGeneration(processor, writer, reader);
            } else {
                runPlain(processor, reader);
            }
        } finally {
            MDC.remove("bundle");
        }

        return 0;
    }

    private void runPlain(BundleProcessor processor, PayloadReader reader) throws IOException {
        List<Path> paths = new ArrayList<>();
        for (File input : inputs) {
            paths.add(input.toPath());
        }
        Archive archive = processor.collect(paths, reader, output.toPath());
        processor.write(archive, output.toPath());
    }

    /**
     * Perspective names come from the input file names: "Top View.png" → perspective "Top View"
     * → entry "1_Top_View.png".
     */
    private void runGeneration(BundleProcessor processor, ArchiveWriter writer, PayloadReader reader)
            throws IOException {
        byte[] originalImage = processor.readPayload(original.toPath(), reader);

        List<GeneratedImage> images = new ArrayList<>();
        for (File input : inputs) {
            String perspective = EntryNames.stem(reader.entryFileName(input.getName()));
            images.add(new GeneratedImage(perspective, processor.readPayload(input.toPath(), reader)));
        }

        BundleFile bundle = new GenerationBundler(writer).bundle(resultId, originalImage, images);
        processor.writeAtomically(bundle.content(), output.toPath());
        log.info("Wrote {} ({} entries, {} bytes)", output.getName(), images.size() + 1, bundle.content().length);
    }
}
