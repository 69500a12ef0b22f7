package com.example.backupuniversal.util;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Formatação de tamanhos, percentuais e datas para logs e listagens.
 */
public final class Formatters {

    private Formatters() {}

    public static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss");

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    /**
     * Ex.: 1536 -> "1.5 KB". Uma casa decimal, base 1024.
     */
    public static String formatBytes(double bytes) {
        double val = bytes;
        for (String unit : UNITS) {
            if (val < 1024.0) {
                return String.format(Locale.ROOT, "%.1f %s", val, unit);
            }
            val /= 1024.0;
        }
        return String.format(Locale.ROOT, "%.1f PB", val);
    }

    /**
     * Percentual economizado: (original - comprimido) / original * 100. Zero se original == 0.
     */
    public static double compressionRatio(long originalSize, long compressedSize) {
        if (originalSize == 0) {
            return 0.0;
        }
        return ((double) (originalSize - compressedSize) / originalSize) * 100.0;
    }

    public static String formatProgress(long current, long total) {
        if (total == 0) {
            return "0.0%";
        }
        return String.format(Locale.ROOT, "%.1f%%", (double) current / total * 100.0);
    }

    /**
     * Separador de milhar com vírgula: 1234567 -> "1,234,567".
     */
    public static String formatNumber(long number) {
        return String.format(Locale.ROOT, "%,d", number);
    }

    public static String formatDate(LocalDateTime date) {
        return DISPLAY_DATE.format(Objects.requireNonNull(date, "date"));
    }

    public static String truncate(String text, int maxLength) {
        return truncate(text, maxLength, "...");
    }

    public static String truncate(String text, int maxLength, String suffix) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        int keep = Math.max(0, maxLength - suffix.length());
        return text.substring(0, keep) + suffix;
    }
}
