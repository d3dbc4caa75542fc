package com.largomodo.debpartial.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Removable media types usable as partition capacity aliases.
 * <p>
 * Usable capacity is 93% of the raw capacity: fixed block (or cluster) allocation makes
 * the space taken by written files grow beyond the sum of their sizes. The margin is not
 * exact, but mostly works.
 * <p>
 * CD capacities count CD-ROM Mode 2 / XA Form 1 blocks of 2048 bytes, 75 blocks per second
 * of audio: a 74 minute CD holds 74*60*75 = 333000 blocks, an 80 minute CD is really
 * 79m57s74 long.
 */
public enum MediaType {
    // 2HD 1.44M floppy disk
    FD("FD", 1_440_000L),

    // Compact Flash
    CF8("CF8", 8L * 1024 * 1024),
    CF16("CF16", 16L * 1024 * 1024),
    CF32("CF32", 32L * 1024 * 1024),
    CF64("CF64", 64L * 1024 * 1024),

    // Magneto-optical
    MO128("MO128", 128L * 1024 * 1024),
    MO230("MO230", 230L * 1024 * 1024),
    MO640("MO640", 640L * 1024 * 1024),
    MO1_3G("MO1.3G", 1300L * 1024 * 1024),

    // 74min (650M) and 80min (700M) CD
    CD74("CD74", 74L * 60 * 75 * 2048),
    CD80("CD80", ((79L * 60 * 75) + (57 * 75) + 74) * 2048),

    // 2.6G DVD-RAM and single layer 4.7G DVD-ROM
    DVD_RAM("DVD-RAM", 2_600_000_000L),
    DVD("DVD", 4_700_000_000L);

    /**
     * Fraction of the raw capacity considered usable.
     */
    public static final double SAFE_SPACE = 0.93;

    private static final Logger log = LoggerFactory.getLogger(MediaType.class);

    private final String alias;
    private final long rawBytes;
    private final long usableBytes;

    MediaType(String alias, long rawBytes) {
        this.alias = alias;
        this.rawBytes = rawBytes;
        this.usableBytes = Math.round(rawBytes * SAFE_SPACE);
    }

    /**
     * Looks up a media type by its alias (case-sensitive, e.g. {@code CD74}, {@code DVD-RAM}).
     *
     * @param alias media alias, may be null
     * @return matching media type, or empty if the alias is unknown
     */
    public static Optional<MediaType> fromAlias(String alias) {
        if (alias == null) {
            return Optional.empty();
        }
        for (MediaType type : values()) {
            if (type.alias.equals(alias)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves an alias to its usable capacity.
     * <p>
     * An unknown alias is not fatal: it is reported as a warning and resolves to zero,
     * which makes the first package placed against it an oversized singleton.
     *
     * @param alias media alias
     * @return usable bytes, or 0 if the alias is unknown
     */
    public static long resolve(String alias) {
        Optional<MediaType> type = fromAlias(alias);
        if (type.isEmpty()) {
            log.warn("Unknown media name: {}", alias);
            return 0;
        }
        return type.get().usableBytes;
    }

    /**
     * @return comma separated list of all built-in aliases, for help and error messages
     */
    public static String supportedAliases() {
        return Arrays.stream(values())
                .map(MediaType::getAlias)
                .collect(Collectors.joining(", "));
    }

    public String getAlias() {
        return alias;
    }

    public long getRawBytes() {
        return rawBytes;
    }

    public long getUsableBytes() {
        return usableBytes;
    }
}
