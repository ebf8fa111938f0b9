package com.flagship.fraud_decisions.validation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects primary account numbers in free text and JSON trees.
 *
 * A candidate is a run of 13 to 19 digits, optionally separated by single spaces or dashes.
 * It is reported when it matches a card-network number format, or failing that, passes the
 * Luhn check. Runs longer than 19 digits are searched window by window. The scanner over-matches
 * on purpose: a missed card number is a compliance failure, a false positive only a dead letter.
 */
public final class PanScanner {

    static final int MIN_DIGITS = 13;
    static final int MAX_DIGITS = 19;

    private static final Pattern DIGIT_RUN = Pattern.compile("\\d(?:[ -]?\\d)*");

    private static final List<Pattern> NETWORK_FORMATS = List.of(
            // Visa
            Pattern.compile("4\\d{12}(?:\\d{3}){0,2}"),
            // Mastercard, including the 2-series range
            Pattern.compile("(?:5[1-5]\\d{2}|222[1-9]|22[3-9]\\d|2[3-6]\\d{2}|27[01]\\d|2720)\\d{12}"),
            // American Express
            Pattern.compile("3[47]\\d{13}"),
            // Discover
            Pattern.compile("6(?:011|5\\d{2}|4[4-9]\\d)\\d{12,15}"),
            // JCB
            Pattern.compile("35(?:2[89]|[3-8]\\d)\\d{12,15}"),
            // Diners Club
            Pattern.compile("3(?:0[0-5]|[689]\\d)\\d{11,16}"),
            // UnionPay
            Pattern.compile("62\\d{14,17}")
    );

    private PanScanner() {
    }

    public static boolean containsPan(String text) {
        if (text == null || text.length() < MIN_DIGITS) {
            return false;
        }
        Matcher matcher = DIGIT_RUN.matcher(text);
        while (matcher.find()) {
            if (matcher.end() - matcher.start() < MIN_DIGITS) {
                continue;
            }
            if (containsCandidate(stripSeparators(matcher.group()))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Walks a JSON tree and returns the path of the first value or key containing a card number.
     * Numbers are scanned in their plain decimal form.
     */
    public static Optional<String> findPan(JsonNode node, String path) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Optional.empty();
        }
        if (node.isTextual()) {
            return containsPan(node.asText()) ? Optional.of(path) : Optional.empty();
        }
        if (node.isNumber()) {
            return containsPan(plainNumber(node)) ? Optional.of(path) : Optional.empty();
        }
        if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                Optional<String> found = findPan(node.get(i), path + "[" + i + "]");
                if (found.isPresent()) {
                    return found;
                }
            }
            return Optional.empty();
        }
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                // the key itself is part of the stored payload
                if (containsPan(field.getKey())) {
                    return Optional.of(path);
                }
                String childPath = path.isEmpty() ? field.getKey() : path + "." + field.getKey();
                Optional<String> found = findPan(field.getValue(), childPath);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    public static boolean passesLuhn(String digits) {
        int sum = 0;
        boolean doubleIt = false;
        for (int i = digits.length() - 1; i >= 0; i--) {
            int digit = digits.charAt(i) - '0';
            if (doubleIt) {
                digit *= 2;
                if (digit > 9) {
                    digit -= 9;
                }
            }
            sum += digit;
            doubleIt = !doubleIt;
        }
        return sum % 10 == 0;
    }

    static boolean looksLikePan(String digits) {
        for (Pattern format : NETWORK_FORMATS) {
            if (format.matcher(digits).matches()) {
                return true;
            }
        }
        return passesLuhn(digits);
    }

    private static boolean containsCandidate(String digits) {
        int length = digits.length();
        if (length < MIN_DIGITS) {
            return false;
        }
        if (length <= MAX_DIGITS) {
            return looksLikePan(digits);
        }
        for (int start = 0; start + MIN_DIGITS <= length; start++) {
            for (int window = MIN_DIGITS; window <= MAX_DIGITS && start + window <= length; window++) {
                if (looksLikePan(digits.substring(start, start + window))) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String stripSeparators(String run) {
        StringBuilder digits = new StringBuilder(run.length());
        for (int i = 0; i < run.length(); i++) {
            char c = run.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }
        return digits.toString();
    }

    private static String plainNumber(JsonNode node) {
        return node.isIntegralNumber()
                ? node.bigIntegerValue().toString()
                : node.decimalValue().toPlainString();
    }
}
