package org.mdacademic.compiler.frontend.parser.ast;

/**
 * A user macro from the front matter's {@code [macros]} table.
 *
 * @param argCount The number of positional arguments, i.e. the highest {@code #N} in the template.
 * @param template The replacement text with {@code #1..#N} placeholders.
 */
public record Macro(int argCount, String template) {

    /**
     * Derives the argument count from the placeholders in the template.
     * @param template The template.
     * @return A macro taking as many arguments as the highest placeholder digit.
     */
    public static Macro fromTemplate(String template) {
        int max = 0;
        for (int i = 0; i + 1 < template.length(); i++) {
            char next = template.charAt(i + 1);
            if (template.charAt(i) == '#' && next >= '1' && next <= '9') {
                max = Math.max(max, next - '0');
            }
        }
        return new Macro(max, template);
    }
}
