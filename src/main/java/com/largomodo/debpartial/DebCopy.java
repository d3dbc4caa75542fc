package com.largomodo.debpartial;

import com.largomodo.debpartial.index.IndexReadException;
import com.largomodo.debpartial.service.ArchiveCopier;
import com.largomodo.debpartial.service.CopyStats;
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
import java.util.concurrent.Callable;

/**
 * CLI entry point copying the files referenced by a partial archive out of a full mirror.
 */
@Command(
        name = "debcopy",
        mixinStandardHelpOptions = true,
        resourceBundle = "debpartial.debpartial",
        version = "${bundle:application.version}",
        header = "Copies the package files of a partial Debian archive from a mirror.",
        description = {
                "Scans DEST for Packages and Sources indices written by debpartial and copies every" +
                        " file they reference from the SOURCE mirror, or links it with --symlink.",
                "Files already present in DEST are left untouched."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion, or files missing from the mirror",
                "1:Execution error (unreadable index, I/O)",
                "2:Invalid command line arguments"
        },
        footerHeading = "%nSee Also:%n",
        footer = {"debpartial(1)"}
)
public class DebCopy implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DebCopy.class);

    @Parameters(index = "0", paramLabel = "SOURCE", description = "Top directory of the full mirror.")
    File source;

    @Parameters(index = "1", paramLabel = "DEST", description = "One partition written by debpartial.")
    File dest;

    @Option(names = {"-l", "--symlink"}, description = "Create relative symbolic links instead of copies.")
    boolean symlink;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        System.exit(new CommandLine(new DebCopy()).execute(args));
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        if (!source.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Mirror is not a directory: " + source.getAbsolutePath());
        }
        if (!dest.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Destination is not a directory: " + dest.getAbsolutePath());
        }

        try {
            CopyStats stats = new ArchiveCopier(source.toPath(), dest.toPath(), symlink).copyAll();
            if (stats.getMissing() > 0) {
                log.warn("{} referenced file(s) could not be found in {}", stats.getMissing(), source);
            }
        } catch (IndexReadException e) {
            log.error("Error!: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Error!: {}", e.toString());
            log.debug("Failure details", e);
            return 1;
        }
        return 0;
    }
}
