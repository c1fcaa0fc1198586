package io.strata.core.privacy;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class PiiRedactor {
    public static final String FULL_PLACEHOLDER = "[REDACTED]";

    private static final Pattern EMAIL = Pattern.compile("(?i)([a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,})");
    // Digit runs inside a decimal number are not card numbers.
    private static final Pattern CARD = Pattern.compile("(?<![\\d.])(?:\\d[ -]?){12,15}\\d(?![\\d]|\\.\\d)");
    private static final Pattern PHONE = Pattern.compile("(\\+\\d{1,2}\\s)?\\(?\\d{3}\\)?[\\s.-]\\d{3}[\\s.-]\\d{4}");
    private static final Pattern IPV4 = Pattern.compile("\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b");

    private final List<Rule> rules;

    public PiiRedactor() {
        this(List.of());
    }

    /**
     * @param identifiers extra case-insensitive identifiers (names, handles) to scrub alongside the
     *                    built-in e-mail, card, phone and IPv4 patterns
     */
    public PiiRedactor(List<String> identifiers) {
        List<Rule> configured = new ArrayList<>();
        configured.add(new Rule("[REDACTED_EMAIL]", EMAIL));
        configured.add(new Rule("[REDACTED_CARD]", CARD));
        configured.add(new Rule("[REDACTED_PHONE]", PHONE));
        configured.add(new Rule("[REDACTED_IP]", IPV4));
        List<String> quoted = new ArrayList<>();
        for (String identifier : identifiers == null ? List.<String>of() : identifiers) {
            if (identifier != null && !identifier.isBlank()) {
                quoted.add(Pattern.quote(identifier.trim()));
            }
        }
        if (!quoted.isEmpty()) {
            configured.add(new Rule("[REDACTED_NAME]", Pattern.compile("(?i)" + String.join("|", quoted))));
        }
        this.rules = List.copyOf(configured);
    }

    public String redact(String input) {
        if (input == null || input.isBlank()) {
            return input == null ? "" : input;
        }
        String out = input;
        for (Rule rule : rules) {
            out = rule.pattern().matcher(out).replaceAll(Matcher.quoteReplacement(rule.placeholder()));
        }
        return out;
    }

    public boolean containsPii(String input) {
        return !findings(input).isEmpty();
    }

    public List<String> findings(String input) {
        if (input == null || input.isBlank()) {
            return List.of();
        }
        List<String> found = new ArrayList<>();
        for (Rule rule : rules) {
            Matcher matcher = rule.pattern().matcher(input);
            while (matcher.find()) {
                found.add(matcher.group());
            }
        }
        return found;
    }

    private record Rule(String placeholder, Pattern pattern) {
    }
}
