package io.github.drompincen.shopbench.runtime.scoring;

import java.util.Map;

/**
 * Judge prompt with named {@code {placeholder}} slots. {@code {{} and
 * {@code }}} render as literal braces.
 */
public final class ScoringPromptTemplate {

    private final String text;

    public ScoringPromptTemplate(String text) {
        this.text = text != null ? text : "";
    }

    public boolean isBlank() {
        return text.isBlank();
    }

    public String text() {
        return text;
    }

    /**
     * @throws IllegalArgumentException on a placeholder missing from
     *         {@code values} or an unbalanced brace
     */
    public String render(Map<String, String> values) {
        StringBuilder out = new StringBuilder(text.length() + 256);
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '{') {
                if (i + 1 < n && text.charAt(i + 1) == '{') {
                    out.append('{');
                    i += 2;
                    continue;
                }
                int close = text.indexOf('}', i + 1);
                if (close < 0) {
                    throw new IllegalArgumentException("Unclosed '{' at offset " + i);
                }
                String name = text.substring(i + 1, close);
                if (!values.containsKey(name)) {
                    throw new IllegalArgumentException("Unknown placeholder {" + name + "}");
                }
                String value = values.get(name);
                out.append(value != null ? value : "");
                i = close + 1;
            } else if (c == '}') {
                if (i + 1 < n && text.charAt(i + 1) == '}') {
                    out.append('}');
                    i += 2;
                    continue;
                }
                throw new IllegalArgumentException("Single '}' at offset " + i);
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }
}
