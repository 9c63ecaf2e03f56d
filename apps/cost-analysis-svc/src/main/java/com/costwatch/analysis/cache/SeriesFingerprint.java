package com.costwatch.analysis.cache;

import com.costwatch.analysis.series.PreparedPoint;
import com.costwatch.analysis.series.PreparedSeries;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 over every (timestamp, value) pair of a series plus the parameters that shape the result.
 */
public final class SeriesFingerprint {

    private SeriesFingerprint() {
    }

    public static String of(PreparedSeries series, Object... parameters) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            update(digest, "points:" + series.size());
            for (PreparedPoint point : series.points()) {
                update(digest, point.timestamp().toString());
                update(digest, Double.toString(point.value()));
            }
            for (Object parameter : parameters) {
                update(digest, parameter == null ? null : parameter.toString());
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 digest unavailable", ex);
        }
    }

    private static void update(MessageDigest digest, String value) {
        if (value == null) {
            digest.update((byte) 0);
        } else {
            digest.update(value.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) '|');
        }
    }
}
