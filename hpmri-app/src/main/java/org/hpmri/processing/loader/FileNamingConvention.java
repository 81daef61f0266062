package org.hpmri.processing.loader;

import java.io.Serializable;
import java.util.Locale;

/**
 * Maps a zero-based slider index to a backend file name of the form
 * {@code <prefix><zero-padded file number><extension>}.
 */
public class FileNamingConvention
        implements Serializable {

    private final String prefix;
    private final int indexDigits;
    private final String extension;
    private final int firstFileNumber;

    /**
     * @param  prefix           fixed file name prefix (may be empty).
     * @param  indexDigits      zero-padded width of the file number.
     * @param  extension        fixed file extension including the leading dot.
     * @param  firstFileNumber  file number that corresponds to slider index 0.
     *
     * @throws IllegalArgumentException
     *   if any of the parameters are invalid.
     */
    public FileNamingConvention(final String prefix,
                                final int indexDigits,
                                final String extension,
                                final int firstFileNumber)
            throws IllegalArgumentException {

        if (indexDigits < 1) {
            throw new IllegalArgumentException("indexDigits must be positive");
        }
        if ((extension == null) || extension.isEmpty()) {
            throw new IllegalArgumentException("extension must be defined");
        }
        if (firstFileNumber < 0) {
            throw new IllegalArgumentException("firstFileNumber must not be negative");
        }

        this.prefix = prefix == null ? "" : prefix;
        this.indexDigits = indexDigits;
        this.extension = extension;
        this.firstFileNumber = firstFileNumber;
    }

    public String getPrefix() {
        return prefix;
    }

    public int getIndexDigits() {
        return indexDigits;
    }

    public String getExtension() {
        return extension;
    }

    public int getFirstFileNumber() {
        return firstFileNumber;
    }

    /**
     * @return name of the file for the specified slider index.
     */
    public String getFileName(final int index) {
        final String format = "%s%0" + indexDigits + "d%s";
        return String.format(Locale.US, format, prefix, firstFileNumber + index, extension);
    }

    /**
     * @return true if the specified file name follows this convention exactly
     *         (same case and same number of digits as {@link #getFileName} produces).
     */
    public boolean matches(final String fileName) {
        boolean matches = false;
        if ((fileName != null) &&
            (fileName.length() == prefix.length() + indexDigits + extension.length()) &&
            fileName.startsWith(prefix) &&
            fileName.endsWith(extension)) {
            final String number = fileName.substring(prefix.length(), fileName.length() - extension.length());
            matches = number.chars().allMatch(c -> (c >= '0') && (c <= '9'));
        }
        return matches;
    }

    /**
     * @return a copy of this convention with the specified values replacing the current ones
     *         (null values keep the current value).
     */
    public FileNamingConvention withOverrides(final String prefix,
                                              final Integer indexDigits,
                                              final String extension,
                                              final Integer firstFileNumber) {
        return new FileNamingConvention(prefix == null ? this.prefix : prefix,
                                        indexDigits == null ? this.indexDigits : indexDigits,
                                        extension == null ? this.extension : extension,
                                        firstFileNumber == null ? this.firstFileNumber : firstFileNumber);
    }

    @Override
    public String toString() {
        return getFileName(0);
    }
}
