package com.intenovation.webmail;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * An immutable IMAP SEARCH query.
 * <p>
 * A query is a list of phrases, each phrase being the wire tokens of one
 * search key. Every predicate method returns a new query with one phrase
 * appended and never changes the receiver, so partially built queries can
 * be shared freely. Phrases are implicitly ANDed by the server.
 * <p>
 * Example:
 * <pre>
 *     ImapQuery query = ImapQuery.create().from("a@b").subject("hi");
 *     query.toString();   // FROM "a@b" SUBJECT "hi"
 * </pre>
 * An empty query serializes to the empty string; callers that want a
 * default (such as unseen only) must check {@link #isEmpty()} themselves.
 * <p>
 * String arguments travel as quoted strings, so they must be single-line
 * US-ASCII; anything else is rejected with {@link QueryArgumentException}.
 * Note that {@link #contains(String)} searches SUBJECT or BODY, not
 * TEXT; use {@link #text(String)} to match anywhere in headers and body.
 */
public final class ImapQuery {

    /**
     * Date format of the SEARCH grammar, e.g. 05-Mar-2024
     */
    public static final DateTimeFormatter IMAP_DATE_FORMAT =
            DateTimeFormatter.ofPattern("dd-MMM-yyyy", Locale.ENGLISH);

    // Accepts one or two digit days and any case in the month name
    private static final DateTimeFormatter IMAP_DATE_PARSER = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("d-MMM-yyyy")
            .toFormatter(Locale.ENGLISH);

    private static final ImapQuery EMPTY = new ImapQuery(Collections.emptyList());

    private final List<List<String>> phrases;

    private ImapQuery(List<List<String>> phrases) {
        this.phrases = phrases;
    }

    /**
     * @return A query with no phrases
     */
    public static ImapQuery create() {
        return EMPTY;
    }

    /**
     * Create a query holding exactly the given phrases
     *
     * @param phrases The phrases, each a list of wire tokens
     * @return The query
     */
    public static ImapQuery of(List<List<String>> phrases) {
        List<List<String>> copy = new ArrayList<>(phrases.size());
        for (List<String> phrase : phrases) {
            copy.add(freeze(phrase));
        }
        return new ImapQuery(Collections.unmodifiableList(copy));
    }

    private static List<String> freeze(List<String> tokens) {
        if (tokens.isEmpty()) {
            throw new InvalidQueryShapeException("A phrase must contain at least one token");
        }
        return Collections.unmodifiableList(new ArrayList<>(tokens));
    }

    /**
     * Append one phrase made of the given tokens
     *
     * @param tokens The wire tokens, already quoted where required
     * @return A new query
     */
    public ImapQuery extend(String... tokens) {
        return extend(Arrays.asList(tokens));
    }

    private ImapQuery extend(List<String> tokens) {
        List<List<String>> next = new ArrayList<>(phrases.size() + 1);
        next.addAll(phrases);
        next.add(freeze(tokens));
        return new ImapQuery(Collections.unmodifiableList(next));
    }

    /**
     * Append every phrase of another query, which ANDs it with this one
     *
     * @param query The query to append
     * @return A new query
     */
    public ImapQuery and(ImapQuery query) {
        List<List<String>> next = new ArrayList<>(phrases.size() + query.phrases.size());
        next.addAll(phrases);
        next.addAll(query.phrases);
        return new ImapQuery(Collections.unmodifiableList(next));
    }

    /**
     * Append a single OR phrase joining the two operands. Each operand must
     * consist of exactly one phrase; compound queries cannot be ORed.
     *
     * @param left The first alternative
     * @param right The second alternative
     * @return A new query
     * @throws InvalidQueryShapeException If an operand has zero or several phrases
     */
    public ImapQuery or(ImapQuery left, ImapQuery right) {
        if (left.phrases.size() != 1 || right.phrases.size() != 1) {
            throw new InvalidQueryShapeException(
                    "Each operand of OR must be exactly one phrase, got " +
                            left.phrases.size() + " and " + right.phrases.size());
        }
        List<String> tokens = new ArrayList<>();
        tokens.add("OR");
        tokens.addAll(left.phrases.get(0));
        tokens.addAll(right.phrases.get(0));
        return extend(tokens);
    }

    /**
     * Append every phrase of the argument prefixed with NOT. Negation is
     * applied per phrase, so a two phrase argument yields two NOT phrases.
     *
     * @param query The query to negate
     * @return A new query
     */
    public ImapQuery not(ImapQuery query) {
        ImapQuery q = this;
        for (List<String> phrase : query.phrases) {
            List<String> tokens = new ArrayList<>(phrase.size() + 1);
            tokens.add("NOT");
            tokens.addAll(phrase);
            q = q.extend(tokens);
        }
        return q;
    }

    /**
     * Match messages whose subject or body contains the text
     */
    public ImapQuery contains(String text) {
        ImapQuery q = create();
        return or(q.subject(text), q.body(text));
    }

    public ImapQuery all() {
        return extend("ALL");
    }

    public ImapQuery answered() {
        return extend("ANSWERED");
    }

    public ImapQuery bcc(String address) {
        return extend("BCC", quote(address));
    }

    public ImapQuery before(String date) {
        return extend("BEFORE", requireDate(date));
    }

    public ImapQuery before(LocalDate date) {
        return extend("BEFORE", format(date));
    }

    public ImapQuery body(String text) {
        return extend("BODY", quote(text));
    }

    public ImapQuery cc(String address) {
        return extend("CC", quote(address));
    }

    public ImapQuery deleted() {
        return extend("DELETED");
    }

    public ImapQuery draft() {
        return extend("DRAFT");
    }

    public ImapQuery flagged() {
        return extend("FLAGGED");
    }

    public ImapQuery from(String address) {
        return extend("FROM", quote(address));
    }

    /**
     * Gmail's raw search extension, which takes the web UI search syntax
     */
    public ImapQuery gmailSearch(String search) {
        return extend("X-GM-RAW", quote(search));
    }

    /**
     * Match messages whose header field contains the value
     *
     * @param field The header field name
     * @param value The text to look for
     * @return A new query
     */
    public ImapQuery header(String field, String value) {
        return extend("HEADER", quote(field), quote(value));
    }

    public ImapQuery keyword(String keyword) {
        return extend("KEYWORD", quote(keyword));
    }

    public ImapQuery larger(long size) {
        return extend("LARGER", Long.toString(requireSize(size)));
    }

    /**
     * Recent and unseen messages (the NEW search key)
     */
    public ImapQuery newMessages() {
        return extend("NEW");
    }

    public ImapQuery old() {
        return extend("OLD");
    }

    public ImapQuery on(String date) {
        return extend("ON", requireDate(date));
    }

    public ImapQuery on(LocalDate date) {
        return extend("ON", format(date));
    }

    public ImapQuery recent() {
        return extend("RECENT");
    }

    public ImapQuery seen() {
        return extend("SEEN");
    }

    public ImapQuery sentBefore(String date) {
        return extend("SENTBEFORE", requireDate(date));
    }

    public ImapQuery sentBefore(LocalDate date) {
        return extend("SENTBEFORE", format(date));
    }

    public ImapQuery sentOn(String date) {
        return extend("SENTON", requireDate(date));
    }

    public ImapQuery sentOn(LocalDate date) {
        return extend("SENTON", format(date));
    }

    public ImapQuery sentSince(String date) {
        return extend("SENTSINCE", requireDate(date));
    }

    public ImapQuery sentSince(LocalDate date) {
        return extend("SENTSINCE", format(date));
    }

    public ImapQuery since(String date) {
        return extend("SINCE", requireDate(date));
    }

    public ImapQuery since(LocalDate date) {
        return extend("SINCE", format(date));
    }

    public ImapQuery smaller(long size) {
        return extend("SMALLER", Long.toString(requireSize(size)));
    }

    public ImapQuery subject(String text) {
        return extend("SUBJECT", quote(text));
    }

    public ImapQuery text(String text) {
        return extend("TEXT", quote(text));
    }

    public ImapQuery to(String address) {
        return extend("TO", quote(address));
    }

    /**
     * Match a UID set such as {@code 12}, {@code 12:20} or {@code 3,7,9}
     */
    public ImapQuery uid(String uidSet) {
        if (uidSet == null || !uidSet.matches("[0-9*:,]+")) {
            throw new QueryArgumentException("Invalid UID set: " + uidSet);
        }
        return extend("UID", uidSet);
    }

    public ImapQuery uid(long uid) {
        return uid(Long.toString(uid));
    }

    public ImapQuery unanswered() {
        return extend("UNANSWERED");
    }

    public ImapQuery undeleted() {
        return extend("UNDELETED");
    }

    public ImapQuery undraft() {
        return extend("UNDRAFT");
    }

    public ImapQuery unflagged() {
        return extend("UNFLAGGED");
    }

    public ImapQuery unkeyword(String keyword) {
        return extend("UNKEYWORD", quote(keyword));
    }

    public ImapQuery unseen() {
        return extend("UNSEEN");
    }

    public boolean isEmpty() {
        return phrases.isEmpty();
    }

    /**
     * @return The phrases in insertion order, unmodifiable
     */
    public List<List<String>> phrases() {
        return phrases;
    }

    /**
     * Get the most recently added phrase as a query of its own. Together
     * with {@link #withoutLastPhrase()} this lets a caller rewrite the tail
     * of a query, e.g. to OR it with the next predicate.
     *
     * @return A single phrase query
     * @throws InvalidQueryShapeException If this query is empty
     */
    public ImapQuery lastPhrase() {
        if (phrases.isEmpty()) {
            throw new InvalidQueryShapeException("The query has no phrases");
        }
        return new ImapQuery(Collections.singletonList(phrases.get(phrases.size() - 1)));
    }

    /**
     * @return This query minus its last phrase
     * @throws InvalidQueryShapeException If this query is empty
     */
    public ImapQuery withoutLastPhrase() {
        if (phrases.isEmpty()) {
            throw new InvalidQueryShapeException("The query has no phrases");
        }
        return new ImapQuery(Collections.unmodifiableList(
                new ArrayList<>(phrases.subList(0, phrases.size() - 1))));
    }

    /**
     * Quote a string argument for the SEARCH grammar, escaping backslash
     * and double quote.
     *
     * @param value The raw value
     * @return The quoted value
     * @throws QueryArgumentException If the value is missing, holds a line
     *         break or holds characters outside printable US-ASCII
     */
    static String quote(String value) {
        if (value == null) {
            throw new QueryArgumentException("Missing search argument");
        }
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\r' || c == '\n') {
                throw new QueryArgumentException("Line breaks are not allowed in a search argument");
            }
            if (c > 0x7e || (c < 0x20 && c != '\t')) {
                throw new QueryArgumentException("Search arguments must be printable US-ASCII: " + value);
            }
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        sb.append('"');
        return sb.toString();
    }

    private static String requireDate(String date) {
        if (date == null || date.trim().isEmpty()) {
            throw new QueryArgumentException("Missing date string or date value");
        }
        String trimmed = date.trim();
        try {
            LocalDate.parse(trimmed, IMAP_DATE_PARSER);
        } catch (DateTimeParseException e) {
            throw new QueryArgumentException("Date must look like 05-Mar-2024: " + date);
        }
        return trimmed;
    }

    private static String format(LocalDate date) {
        if (date == null) {
            throw new QueryArgumentException("Missing date string or date value");
        }
        return IMAP_DATE_FORMAT.format(date);
    }

    private static long requireSize(long size) {
        if (size < 0) {
            throw new QueryArgumentException("Size must not be negative: " + size);
        }
        return size;
    }

    /**
     * @return The wire form: all tokens of all phrases, space separated
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (List<String> phrase : phrases) {
            for (String token : phrase) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(token);
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ImapQuery)) {
            return false;
        }
        return phrases.equals(((ImapQuery) o).phrases);
    }

    @Override
    public int hashCode() {
        return phrases.hashCode();
    }
}
