package github.sarthakdev143.hdr_merge.service.impl;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sorted view over the input paths of a bracketed set. Negative indices count from the end and
 * out-of-range indices yield an empty string.
 */
public class FileNameIndex {

    private final List<String> fileNames;

    public FileNameIndex(List<String> fileNames) {
        List<String> sorted = new ArrayList<>(fileNames);
        Collections.sort(sorted);
        this.fileNames = List.copyOf(sorted);
    }

    public int size() {
        return fileNames.size();
    }

    public String fileName(int index) {
        int resolved = adjustIndex(index);
        return resolved < 0 ? "" : baseName(fileNames.get(resolved));
    }

    public String fileNameWithoutExtension(int index) {
        int resolved = adjustIndex(index);
        if (resolved < 0) {
            return "";
        }
        String name = baseName(fileNames.get(resolved));
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

    public String directory(int index) {
        int resolved = adjustIndex(index);
        return resolved < 0 ? "" : directoryOf(fileNames.get(resolved));
    }

    public String numericSuffix(int index) {
        String name = fileNameWithoutExtension(index);
        int start = name.length();
        while (start > 0 && isAsciiDigit(name.charAt(start - 1))) {
            start--;
        }
        return name.substring(start);
    }

    private int adjustIndex(int index) {
        int resolved = index < 0 ? fileNames.size() + index : index;
        return resolved >= 0 && resolved < fileNames.size() ? resolved : -1;
    }

    static String baseName(String fileName) {
        int slash = fileName.lastIndexOf('/');
        return slash < 0 ? fileName : fileName.substring(slash + 1);
    }

    static String directoryOf(String fileName) {
        try {
            Path parent = Path.of(fileName).toAbsolutePath().normalize().getParent();
            return parent == null ? "" : parent.toString();
        } catch (InvalidPathException e) {
            return "";
        }
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
