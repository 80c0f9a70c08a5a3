package agentic.compiler;

/**
 * JSX text whitespace rules: lines are trimmed where they meet a line break, blank lines
 * vanish and the remaining lines are joined with single spaces.
 */
final class JsxWhitespace {
    private JsxWhitespace() {}

    static String normalize(String raw) {
        String[] lines = raw.split("\r\n|\n|\r", -1);
        int lastNonEmpty = -1;
        for (int i = 0; i < lines.length; i++) {
            if (!lines[i].isBlank()) lastNonEmpty = i;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].replace('\t', ' ');
            boolean first = i == 0;
            boolean last = i == lines.length - 1;
            if (!first) line = line.stripLeading();
            if (!last) line = line.stripTrailing();
            if (line.isEmpty()) continue;
            sb.append(line);
            if (i != lastNonEmpty) sb.append(' ');
        }
        return sb.toString();
    }

    /** Raw text kept verbatim apart from leading blank lines and trailing whitespace. */
    static String verbatim(String raw) {
        String s = raw.stripTrailing();
        int start = 0;
        while (true) {
            int nl = s.indexOf('\n', start);
            if (nl < 0 || !s.substring(start, nl).isBlank()) break;
            start = nl + 1;
        }
        return s.substring(start);
    }
}
