package software.amazon.dfa;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Compiles an automaton described by a JSON document into a {@link Dfa}. The document looks like this:
 * <pre>
 * {
 *   "alphabet": "01",
 *   "states": 3,
 *   "initialState": 0,
 *   "acceptingStates": [ 0 ],
 *   "transitions": [
 *     { "from": 0, "symbol": "0", "to": 0 },
 *     { "from": 0, "symbol": "1", "to": 1 },
 *     ...
 *   ]
 * }
 * </pre>
 * "alphabet" is a string whose characters are the symbols, in order. "transitions" may be omitted or partial; the
 * resulting automaton then reports {@link Outcome#INCOMPLETE_TABLE} until the caller fills in the rest.
 *
 * Structural problems (wrong token types, unknown or repeated fields, missing fields) are reported as
 * JsonParseException with the location in the source. Problems with the automaton itself, such as a transition to a
 * state that does not exist, are reported by the {@link DfaException} subclasses Dfa throws.
 */
public class JsonDfaCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(JsonDfaCompiler.class);

    static final String ALPHABET = "alphabet";
    static final String STATES = "states";
    static final String INITIAL_STATE = "initialState";
    static final String ACCEPTING_STATES = "acceptingStates";
    static final String TRANSITIONS = "transitions";
    static final String FROM = "from";
    static final String SYMBOL = "symbol";
    static final String TO = "to";

    private static final JsonFactory JSON_FACTORY = JsonFactory.builder()
            .configure(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION, true)
            .build();

    private JsonDfaCompiler() { }

    /**
     * Verify an automaton definition.
     * @param source definition, as a String
     * @return null if the definition is valid, otherwise an error message
     */
    public static String check(final String source) {
        try {
            doCompile(JSON_FACTORY.createParser(source), true);
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final Reader source) {
        try {
            doCompile(JSON_FACTORY.createParser(source), true);
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final byte[] source) {
        try {
            doCompile(JSON_FACTORY.createParser(source), true);
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final InputStream source) {
        try {
            doCompile(JSON_FACTORY.createParser(source), true);
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Compile an automaton from its JSON form.
     *
     * @param source definition, as a String
     * @param withOverriding whether a transition listed twice replaces the earlier one, or is rejected
     * @return the automaton, with every listed transition registered
     * @throws IOException if the definition isn't syntactically valid
     */
    public static Dfa compile(final String source, final boolean withOverriding) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source), withOverriding);
    }

    public static Dfa compile(final String source) throws IOException {
        return compile(source, true);
    }

    public static Dfa compile(final Reader source, final boolean withOverriding) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source), withOverriding);
    }

    public static Dfa compile(final Reader source) throws IOException {
        return compile(source, true);
    }

    public static Dfa compile(final byte[] source, final boolean withOverriding) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source), withOverriding);
    }

    public static Dfa compile(final byte[] source) throws IOException {
        return compile(source, true);
    }

    public static Dfa compile(final InputStream source, final boolean withOverriding) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source), withOverriding);
    }

    public static Dfa compile(final InputStream source) throws IOException {
        return compile(source, true);
    }

    private static Dfa doCompile(final JsonParser parser, final boolean withOverriding) throws IOException {
        try (JsonParser p = parser) {
            if (p.nextToken() != JsonToken.START_OBJECT) {
                barf(p, "Automaton definition is not an object");
            }
            final Dfa.Builder builder = Dfa.builder().withOverridesForDuplicateTransitions(withOverriding);
            final List<Transition> transitions = new ArrayList<>();
            final Set<String> seen = new HashSet<>();

            while (p.nextToken() != JsonToken.END_OBJECT) {
                final String fieldName = p.getCurrentName();
                if (!seen.add(fieldName)) {
                    barf(p, String.format("\"%s\" appears more than once", fieldName));
                }
                p.nextToken();
                switch (fieldName) {
                    case ALPHABET:
                        builder.withAlphabet(readAlphabet(p));
                        break;
                    case STATES:
                        builder.withStateCount(readInt(p, STATES));
                        break;
                    case INITIAL_STATE:
                        builder.withInitialState(readInt(p, INITIAL_STATE));
                        break;
                    case ACCEPTING_STATES:
                        builder.withAcceptingStates(readAcceptingStates(p));
                        break;
                    case TRANSITIONS:
                        readTransitions(p, transitions);
                        break;
                    default:
                        barf(p, String.format("Unrecognized field \"%s\"", fieldName));
                }
            }
            for (String required : new String[] { ALPHABET, STATES, INITIAL_STATE, ACCEPTING_STATES }) {
                if (!seen.contains(required)) {
                    barf(p, String.format("Missing required field \"%s\"", required));
                }
            }

            if (p.nextToken() != null) {
                barf(p, "Unexpected content after the automaton definition");
            }

            final Dfa dfa;
            try {
                dfa = builder.build();
            } catch (IllegalArgumentException e) {
                throw new JsonParseException(p, e.getMessage(), p.getCurrentLocation());
            }
            dfa.addTransitions(transitions);
            LOG.debug("Compiled DFA with {} states, {} transitions listed, {} cells still unset",
                    dfa.getStateCount(), transitions.size(), dfa.getIncompleteCellCount());
            return dfa;
        }
    }

    private static Alphabet readAlphabet(final JsonParser parser) throws IOException {
        if (parser.currentToken() != JsonToken.VALUE_STRING) {
            barf(parser, String.format("\"%s\" must be a string", ALPHABET));
        }
        try {
            return Alphabet.of(parser.getText());
        } catch (IllegalArgumentException e) {
            throw new JsonParseException(parser, e.getMessage(), parser.getCurrentLocation());
        }
    }

    private static int[] readAcceptingStates(final JsonParser parser) throws IOException {
        if (parser.currentToken() != JsonToken.START_ARRAY) {
            barf(parser, String.format("\"%s\" must be an array", ACCEPTING_STATES));
        }
        final List<Integer> states = new ArrayList<>();
        while (parser.nextToken() != JsonToken.END_ARRAY) {
            states.add(readInt(parser, ACCEPTING_STATES));
        }
        return states.stream().mapToInt(Integer::intValue).toArray();
    }

    private static void readTransitions(final JsonParser parser, final List<Transition> transitions)
            throws IOException {
        if (parser.currentToken() != JsonToken.START_ARRAY) {
            barf(parser, String.format("\"%s\" must be an array", TRANSITIONS));
        }
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            if (token != JsonToken.START_OBJECT) {
                barf(parser, "Each transition must be an object");
            }
            transitions.add(readTransition(parser));
        }
    }

    private static Transition readTransition(final JsonParser parser) throws IOException {
        Integer from = null;
        Character symbol = null;
        Integer to = null;
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            final String fieldName = parser.getCurrentName();
            parser.nextToken();
            switch (fieldName) {
                case FROM:
                    if (from != null) {
                        barf(parser, String.format("\"%s\" appears more than once in a transition", FROM));
                    }
                    from = readInt(parser, FROM);
                    break;
                case TO:
                    if (to != null) {
                        barf(parser, String.format("\"%s\" appears more than once in a transition", TO));
                    }
                    to = readInt(parser, TO);
                    break;
                case SYMBOL:
                    if (symbol != null) {
                        barf(parser, String.format("\"%s\" appears more than once in a transition", SYMBOL));
                    }
                    if (parser.currentToken() != JsonToken.VALUE_STRING || parser.getTextLength() != 1) {
                        barf(parser, String.format("\"%s\" must be a single-character string", SYMBOL));
                    }
                    symbol = parser.getText().charAt(0);
                    break;
                default:
                    barf(parser, String.format("Unrecognized transition field \"%s\"", fieldName));
            }
        }
        if (from == null || symbol == null || to == null) {
            barf(parser, String.format("A transition needs \"%s\", \"%s\" and \"%s\"", FROM, SYMBOL, TO));
        }
        return new Transition(from, symbol, to);
    }

    private static int readInt(final JsonParser parser, final String fieldName) throws IOException {
        if (parser.currentToken() != JsonToken.VALUE_NUMBER_INT) {
            barf(parser, String.format("\"%s\" must contain integers", fieldName));
        }
        if (parser.getNumberType() != JsonParser.NumberType.INT) {
            barf(parser, String.format("\"%s\" value %s is out of range", fieldName, parser.getText()));
        }
        return parser.getIntValue();
    }

    private static void barf(final JsonParser parser, final String message) throws JsonParseException {
        throw new JsonParseException(parser, message, parser.getCurrentLocation());
    }
}
