package github.sarthakdev143.hdr_merge.service.impl;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands output file name patterns.
 * <p>
 * Tokens: {@code %%} for a literal percent sign, {@code %if[n]} for the file name of input
 * {@code n}, {@code %iF[n]} for the same without extension, {@code %id[n]} for its directory and
 * {@code %in[n]} for its trailing digits. When an output file name is supplied, {@code %of} and
 * {@code %od} expand to its file name and directory. Anything else is kept verbatim.
 */
public class OutputPathResolver {

    static final String SINGLE_INPUT_PATTERN = "%id[-1]/%iF[0].dng";
    static final String MULTI_INPUT_PATTERN = "%id[-1]/%iF[0]-%in[-1].dng";
    private static final String DNG_EXTENSION = ".dng";

    private static final Pattern INPUT_TOKENS = Pattern.compile("%(?:i[fFdn]\\[(-?[0-9]+)\\]|%)");
    private static final Pattern INPUT_AND_OUTPUT_TOKENS =
            Pattern.compile("%(?:o[fd]|i[fFdn]\\[(-?[0-9]+)\\]|%)");

    private final FileNameIndex index;

    public OutputPathResolver(List<String> fileNames) {
        this.index = new FileNameIndex(fileNames);
    }

    public String resolve(String pattern) {
        return resolve(pattern, "");
    }

    public String resolve(String pattern, String outputFileName) {
        boolean hasOutput = outputFileName != null && !outputFileName.isEmpty();
        Pattern tokens = hasOutput ? INPUT_AND_OUTPUT_TOKENS : INPUT_TOKENS;
        String result = pattern;
        int offset = 0;
        Matcher matcher = tokens.matcher(result);
        while (offset <= result.length() && matcher.find(offset)) {
            String replacement = replacementFor(matcher, outputFileName);
            result = result.substring(0, matcher.start()) + replacement + result.substring(matcher.end());
            offset = matcher.start() + replacement.length();
            matcher = tokens.matcher(result);
        }
        return result;
    }

    public String defaultOutputFileName() {
        return resolve(index.size() == 1 ? SINGLE_INPUT_PATTERN : MULTI_INPUT_PATTERN);
    }

    /**
     * Output name for a user pattern, or the default name when the pattern is blank.
     */
    public String outputFileName(String userPattern) {
        if (userPattern == null || userPattern.isBlank()) {
            return defaultOutputFileName();
        }
        String resolved = resolve(userPattern);
        return resolved.endsWith(DNG_EXTENSION) ? resolved : resolved + DNG_EXTENSION;
    }

    private String replacementFor(Matcher matcher, String outputFileName) {
        String token = matcher.group();
        if (token.equals("%%")) {
            return "%";
        }
        if (token.equals("%of")) {
            return FileNameIndex.baseName(outputFileName);
        }
        if (token.equals("%od")) {
            return FileNameIndex.directoryOf(outputFileName);
        }

        int position = parseIndex(matcher.group(1));
        return switch (token.charAt(2)) {
            case 'f' -> index.fileName(position);
            case 'F' -> index.fileNameWithoutExtension(position);
            case 'd' -> index.directory(position);
            default -> index.numericSuffix(position);
        };
    }

    private static int parseIndex(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            // Beyond int range can never address an input.
            return Integer.MIN_VALUE;
        }
    }
}
