package com.largomodo.debpartial.service;

import com.largomodo.debpartial.core.domain.Partition;
import com.largomodo.debpartial.core.domain.PartitionPlan;
import com.largomodo.debpartial.core.domain.SourceMode;
import com.largomodo.debpartial.index.BinaryIndex;
import com.largomodo.debpartial.index.SourceIndex;
import com.largomodo.debpartial.index.StanzaReader;
import com.largomodo.debpartial.index.Stanza;
import com.largomodo.debpartial.service.workspace.EmissionWorkspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.GZIPOutputStream;

/**
 * Writes one gzip-compressed Packages and Sources index per partition, distribution,
 * section and architecture under the destination root.
 * <p>
 * Within a distribution and section every source is written once, to the first partition
 * that needs it.
 */
public class IndexEmitter {

    private static final Logger log = LoggerFactory.getLogger(IndexEmitter.class);

    static final String MDC_INDEX = "index";

    private final ArchiveLayout layout;
    private final PartitionNaming naming;

    public IndexEmitter(ArchiveLayout layout, PartitionNaming naming) {
        if (layout == null || naming == null) {
            throw new IllegalArgumentException("layout and naming cannot be null");
        }
        this.layout = layout;
        this.naming = naming;
    }

    /**
     * Logs the plan summary and writes every index of the plan.
     *
     * @param plan     partitioning result
     * @param archive  indices the stanzas are taken from
     * @param destRoot destination root, created if absent
     * @throws IOException if any index cannot be written; already promoted indices stay
     */
    public void emit(PartitionPlan plan, LoadedArchive archive, Path destRoot) throws IOException {
        summarize(plan).forEach(log::info);

        try (EmissionWorkspace workspace = new EmissionWorkspace(destRoot)) {
            for (String dist : layout.dists()) {
                for (String section : layout.sections()) {
                    MDC.put(MDC_INDEX, dist + "/" + section);
                    try {
                        emitSection(workspace, plan, archive, destRoot, dist, section);
                    } finally {
                        MDC.remove(MDC_INDEX);
                    }
                }
            }
        }
    }

    private void emitSection(EmissionWorkspace workspace, PartitionPlan plan, LoadedArchive archive,
                             Path destRoot, String dist, String section) throws IOException {
        SourceIndex sourceIndex = archive.sourceIndex(dist, section);
        Set<String> written = new HashSet<>();

        for (Partition partition : plan.packagePartitions()) {
            Path partitionRoot = destRoot.resolve(naming.packageDir(partition.index()));
            for (String arch : layout.arches()) {
                BinaryIndex binaryIndex = archive.binaryIndex(dist, section, arch);
                List<Stanza> stanzas = new ArrayList<>();
                for (String name : partition.items()) {
                    Stanza stanza = binaryIndex == null ? null : binaryIndex.stanzaOf(name);
                    if (stanza != null) {
                        stanzas.add(stanza);
                    }
                }
                write(workspace, layout.packagesIndex(partitionRoot, dist, section, arch), stanzas, destRoot);
            }
            if (plan.sourceMode() == SourceMode.MERGE && sourceIndex != null) {
                write(workspace, layout.sourcesIndex(partitionRoot, dist, section),
                        unwritten(sourceIndex, partition.sources(), written), destRoot);
            }
        }

        if (plan.sourceMode() == SourceMode.SEPARATE && sourceIndex != null) {
            int packagePartitions = plan.packagePartitions().size();
            for (Partition partition : plan.sourcePartitions()) {
                Path partitionRoot = destRoot.resolve(naming.sourceDir(partition.index(), packagePartitions));
                write(workspace, layout.sourcesIndex(partitionRoot, dist, section),
                        unwritten(sourceIndex, partition.items(), written), destRoot);
            }
        }
    }

    private static List<Stanza> unwritten(SourceIndex index, Collection<String> sources, Set<String> written) {
        List<Stanza> stanzas = new ArrayList<>();
        for (String source : sources) {
            Stanza stanza = index.stanzaOf(source);
            if (stanza != null && written.add(source)) {
                stanzas.add(stanza);
            }
        }
        return stanzas;
    }

    private void write(EmissionWorkspace workspace, Path target, List<Stanza> stanzas, Path destRoot)
            throws IOException {
        Path staged = workspace.stage(target);
        try (Writer writer = new OutputStreamWriter(
                new GZIPOutputStream(Files.newOutputStream(staged)), StanzaReader.CHARSET)) {
            for (Stanza stanza : stanzas) {
                writer.write(stanza.text());
                writer.write('\n');
            }
        }
        workspace.promoteToFinal(staged, target);
        log.debug("Wrote {} ({} entries)", destRoot.relativize(target), stanzas.size());
    }

    /**
     * One line per partition, e.g. {@code Debian0: 12 packages. Size: 4096 [ base-files, ... ]}.
     * Merge mode appends the charged source size and the total after the package size.
     *
     * @param plan partitioning result
     * @return summary lines, package partitions first
     */
    public List<String> summarize(PartitionPlan plan) {
        List<String> lines = new ArrayList<>();
        for (Partition partition : plan.packagePartitions()) {
            StringBuilder line = new StringBuilder()
                    .append(naming.packageDir(partition.index())).append(": ")
                    .append(partition.items().size()).append(" packages. Size: ")
                    .append(partition.itemSize());
            if (plan.sourceMode() == SourceMode.MERGE) {
                line.append(" + ").append(partition.sourceSize())
                        .append(" = ").append(partition.size());
            }
            lines.add(line.append(preview(partition.items())).toString());
        }
        int packagePartitions = plan.packagePartitions().size();
        for (Partition partition : plan.sourcePartitions()) {
            lines.add(naming.sourceDir(partition.index(), packagePartitions) + ": "
                    + partition.items().size() + " sources. Size: " + partition.itemSize()
                    + preview(partition.items()));
        }
        return lines;
    }

    private static String preview(List<String> items) {
        if (items.isEmpty()) {
            return "";
        }
        return " [ " + items.get(0) + (items.size() > 1 ? ", ..." : "") + " ]";
    }
}
