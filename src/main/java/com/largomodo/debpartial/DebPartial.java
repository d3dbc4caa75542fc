package com.largomodo.debpartial;

import com.largomodo.debpartial.core.CapacitySequence;
import com.largomodo.debpartial.core.LoggingPartitionObserver;
import com.largomodo.debpartial.core.PackageSelection;
import com.largomodo.debpartial.core.PartitionObserver;
import com.largomodo.debpartial.core.PartitionTooSmallException;
import com.largomodo.debpartial.core.domain.GreedyPartitioner;
import com.largomodo.debpartial.core.domain.PartitionOptions;
import com.largomodo.debpartial.core.domain.PartitionPlan;
import com.largomodo.debpartial.core.domain.Partitioner;
import com.largomodo.debpartial.core.domain.SourceMode;
import com.largomodo.debpartial.index.IndexReadException;
import com.largomodo.debpartial.service.ArchiveLayout;
import com.largomodo.debpartial.service.ArchiveLoader;
import com.largomodo.debpartial.service.IndexEmitter;
import com.largomodo.debpartial.service.LoadedArchive;
import com.largomodo.debpartial.service.PartitionNaming;
import com.largomodo.debpartial.service.workspace.CleanupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point splitting a Debian archive into media-sized partial archives.
 * <p>
 * Reads the Packages (and Sources) indices of {@code SOURCE}, packs the selected packages
 * into partitions with {@link GreedyPartitioner} and writes one partial index tree per
 * partition under {@code DEST}. Package files themselves are not copied; see {@link DebCopy}.
 */
@Command(
        name = "debpartial",
        mixinStandardHelpOptions = true,
        resourceBundle = "debpartial.debpartial",
        version = "${bundle:application.version}",
        header = "Splits a Debian archive into partial archives that each fit one medium.",
        description = {
                "Reads the Packages and Sources indices of a Debian archive and writes partial index" +
                        " trees, one per partition, whose packages fit the given media sizes.",
                "",
                "Media sizes may be byte counts or media names: FD, CF8, CF16, CF32, CF64, MO128, MO230," +
                        " MO640, MO1.3G, CD74, CD80, DVD-RAM, DVD."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:Execution error (unreadable index, partition too small, I/O)",
                "2:Invalid command line arguments"
        },
        footerHeading = "%nSee Also:%n",
        footer = {"debcopy(1)"}
)
public class DebPartial implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DebPartial.class);

    @Parameters(index = "0", paramLabel = "SOURCE", description = "Top directory of the source archive.")
    File source;

    @Parameters(index = "1", paramLabel = "DEST", description = "Directory the partial archives are written to.")
    File dest;

    @Option(names = {"-S", "--size"}, defaultValue = "CD74", converter = CapacitySequenceConverter.class,
            paramLabel = "SIZE[,SIZE...]",
            description = {
                    "Partition sizes; the last one repeats, 0 repeats the previous one.",
                    "Default: ${DEFAULT-VALUE}"
            })
    CapacitySequence size;

    @Option(names = {"-R", "--srcsize"}, converter = CapacitySequenceConverter.class,
            paramLabel = "SIZE[,SIZE...]",
            description = "Source partition sizes. Default: same as --size")
    CapacitySequence sourceSize;

    @Option(names = {"-d", "--dist"}, split = ",", defaultValue = "unstable",
            description = "Distributions to handle. Default: ${DEFAULT-VALUE}")
    List<String> dists;

    @Option(names = {"-s", "--section"}, split = ",", defaultValue = "main,contrib,non-free",
            description = "Sections to handle. Default: ${DEFAULT-VALUE}")
    List<String> sections;

    @Option(names = {"-a", "--arch"}, split = ",", defaultValue = "i386",
            description = "Architectures to handle. Default: ${DEFAULT-VALUE}")
    List<String> arches;

    @Option(names = {"-i", "--include"}, split = ",", paramLabel = "PACKAGE",
            description = "Packages to include, in this order. Default: all packages")
    List<String> includes = new ArrayList<>();

    @Option(names = "--include-from", paramLabel = "FILE",
            description = "File listing packages to include, one per line.")
    File includeFrom;

    @Option(names = {"-D", "--dirmap"}, split = ",", paramLabel = "NAME",
            description = "Directory names of the partitions. Default: the partition index")
    List<String> dirMap = new ArrayList<>();

    @Option(names = "--dirprefix", defaultValue = "Debian",
            description = "Prefix of partition directories. Default: ${DEFAULT-VALUE}")
    String dirPrefix;

    @Option(names = "--dirsrcprefix", defaultValue = "Debian-Src",
            description = "Prefix of source partition directories, ignored with --merge-source. Default: ${DEFAULT-VALUE}")
    String dirSourcePrefix;

    @Option(names = {"-l", "--limit"}, defaultValue = "0",
            description = "Maximum number of partitions, 0 for no limit. Default: ${DEFAULT-VALUE}")
    int limit;

    @Option(names = "--nosource", description = "Do not handle sources.")
    boolean noSource;

    @Option(names = {"-m", "--merge-source"}, description = "Put sources into the partition of their packages.")
    boolean mergeSource;

    @Option(names = {"-I", "--ignore-large-packages"},
            description = "Skip packages larger than their partition instead of aborting.")
    boolean ignoreLargePackages;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new DebPartial());
        cmd.setOverwrittenOptionsAllowed(true);
        return cmd;
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        validate();

        SourceMode mode = noSource ? SourceMode.NONE : mergeSource ? SourceMode.MERGE : SourceMode.SEPARATE;
        ArchiveLayout layout = new ArchiveLayout(dists, sections, arches);
        PartitionNaming naming = new PartitionNaming(dirMap, dirPrefix,
                mode == SourceMode.MERGE ? dirPrefix : dirSourcePrefix);
        PartitionOptions options = new PartitionOptions(size, sourceSize, limit, mode, ignoreLargePackages);
        PartitionObserver observer = new LoggingPartitionObserver();

        try {
            LoadedArchive archive = new ArchiveLoader(layout).load(source.toPath(), mode != SourceMode.NONE);
            List<String> packages = PackageSelection.select(archive.packages(), includes,
                    includeFrom == null ? null : includeFrom.toPath(), observer);

            Partitioner partitioner = new GreedyPartitioner(archive.packages(),
                    mode == SourceMode.NONE ? null : archive.sources(), options, observer);
            PartitionPlan plan = partitioner.partition(packages);

            Path destRoot = dest.toPath();
            Files.createDirectories(destRoot);
            new IndexEmitter(layout, naming).emit(plan, archive, destRoot);

            log.info("{} package partition(s), {} source partition(s), {} package(s) skipped",
                    plan.packagePartitions().size(), plan.sourcePartitions().size(), plan.skipped().size());
        } catch (PartitionTooSmallException | IndexReadException e) {
            log.error("Error!: {}", e.getMessage());
            return 1;
        } catch (IOException | CleanupException e) {
            log.error("Error!: {}", e.toString());
            log.debug("Failure details", e);
            return 1;
        }
        return 0;
    }

    private void validate() {
        if (mergeSource && noSource) {
            throw new ParameterException(spec.commandLine(),
                    "--merge-source cannot be combined with --nosource");
        }
        if (limit < 0) {
            throw new ParameterException(spec.commandLine(), "--limit must not be negative: " + limit);
        }
        // Separate sources take a partition of their own out of the same limit
        if (limit == 1 && !mergeSource && !noSource) {
            throw new ParameterException(spec.commandLine(),
                    "--limit 1 leaves no partition for packages; use --merge-source or --nosource");
        }
        if (!source.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Source archive is not a directory: " + source.getAbsolutePath());
        }
        if (dest.exists() && !dest.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Destination must be a directory, not a file: " + dest.getAbsolutePath());
        }
        if (includeFrom != null && !includeFrom.canRead()) {
            throw new ParameterException(spec.commandLine(),
                    "Include file is not readable: " + includeFrom.getAbsolutePath());
        }
    }
}
