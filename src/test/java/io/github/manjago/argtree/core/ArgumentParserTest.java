package io.github.manjago.argtree.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for parsing command lines against a tree.
 */
class ArgumentParserTest {

    private ArgumentParser parser;

    @BeforeEach
    void setUp() {
        parser = new ArgumentParser("tool", "Test tool");
    }

    private ParseException parseFailure(String... args) {
        ParseException e = assertThrows(ParseException.class, () -> parser.parseOrThrow(args));
        assertFalse(parser.isParsed());
        return e;
    }

    // ========== Flags ==========

    @Nested
    @DisplayName("Flags")
    class Flags {

        private FlagOption verbose;

        @BeforeEach
        void setUp() {
            verbose = parser.addFlag('v', "verbose", "Be verbose");
        }

        @Test
        @DisplayName("Separate -v tokens are counted")
        void testRepeatedFlag() {
            assertTrue(parser.parse("-v", "-v", "-v"));
            assertEquals(3, verbose.count());
            assertTrue(verbose.isSet());
        }

        @Test
        @DisplayName("-vvv is the same as -v -v -v")
        void testGroupedFlag() {
            assertTrue(parser.parse("-vvv"));
            assertEquals(3, verbose.count());
            assertTrue(verbose.isSet());
        }

        @Test
        @DisplayName("Long and short forms add up")
        void testMixedForms() {
            assertTrue(parser.parse("--verbose", "-v"));
            assertEquals(2, verbose.count());
        }

        @Test
        @DisplayName("Flag not given is not set")
        void testAbsentFlag() {
            assertTrue(parser.parse());
            assertEquals(0, verbose.count());
            assertFalse(verbose.isSet());
            assertFalse(verbose.isPresent());
        }

        @Test
        @DisplayName("Group of different flags counts each one")
        void testGroupOfDifferentFlags() {
            FlagOption quiet = parser.addFlag('q', "quiet", "Be quiet");

            assertTrue(parser.parse("-vqv"));
            assertEquals(2, verbose.count());
            assertEquals(1, quiet.count());
        }

        @Test
        @DisplayName("Value option inside a group is ambiguous")
        void testAmbiguousGroup() {
            ValueOption<String> output = parser.addValue('o', "output", ValueType.STRING, "Output");

            ParseException e = parseFailure("-vo", "out.txt");
            assertEquals(ParseException.Kind.AMBIGUOUS_SHORT_GROUP, e.getKind());
            assertEquals("-vo", e.getToken());
            assertEquals("-o/--output", e.getArgument());
            assertEquals(0, verbose.count(), "group is rejected as a whole");
            assertFalse(output.isPresent());
        }

        @Test
        @DisplayName("Unknown character in a group")
        void testUnknownInGroup() {
            ParseException e = parseFailure("-vx");
            assertEquals(ParseException.Kind.UNKNOWN_OPTION, e.getKind());
            assertEquals("-x", e.getArgument());
            assertEquals(0, verbose.count());
        }

        @Test
        @DisplayName("Unknown long and short options")
        void testUnknownOptions() {
            assertEquals(ParseException.Kind.UNKNOWN_OPTION, parseFailure("--verbos").getKind());
        }

        @Test
        @DisplayName("Unknown short option")
        void testUnknownShort() {
            ParseException e = parseFailure("-x");
            assertEquals(ParseException.Kind.UNKNOWN_OPTION, e.getKind());
            assertEquals("-x", e.getToken());
            assertTrue(e.getMessage().contains("unknown option '-x'"), e.getMessage());
        }
    }

    // ========== Values and lists ==========

    @Nested
    @DisplayName("Value and list options")
    class Values {

        private ValueOption<String> name;
        private ListOption<Integer> ports;
        private FlagOption force;

        @BeforeEach
        void setUp() {
            name = parser.addValue('n', "name", ValueType.STRING, "Name");
            ports = parser.addList('p', "port", ValueType.INTEGER, "Ports");
            force = parser.addFlag('f', "force", "Force");
        }

        @Test
        @DisplayName("--name alice binds the value")
        void testLongValue() {
            assertTrue(parser.parse("--name", "alice"));
            assertEquals("alice", name.value().orElseThrow());
            assertTrue(name.isPresent());
        }

        @Test
        @DisplayName("-n alice binds the value")
        void testShortValue() {
            assertTrue(parser.parse("-n", "alice"));
            assertEquals("alice", name.value().orElseThrow());
        }

        @Test
        @DisplayName("--name alone is a missing value")
        void testMissingValue() {
            ParseException e = parseFailure("--name");
            assertEquals(ParseException.Kind.MISSING_VALUE, e.getKind());
            assertEquals("-n/--name", e.getArgument());
            assertTrue(name.value().isEmpty());
        }

        @Test
        @DisplayName("Value option does not take the next flag as its value")
        void testValueStopsAtFlag() {
            ParseException e = parseFailure("--name", "--force");
            assertEquals(ParseException.Kind.MISSING_VALUE, e.getKind());
            assertFalse(force.isSet());
        }

        @Test
        @DisplayName("Extra token after a value is not swallowed")
        void testValueTakesOneToken() {
            ParseException e = parseFailure("--name", "alice", "bob");
            assertEquals(ParseException.Kind.UNEXPECTED_TOKEN, e.getKind());
            assertEquals("bob", e.getToken());
        }

        @Test
        @DisplayName("Repeated value option keeps the last value")
        void testRepeatedValue() {
            assertTrue(parser.parse("--name", "alice", "--name", "bob"));
            assertEquals("bob", name.value().orElseThrow());
        }

        @Test
        @DisplayName("List option takes tokens up to the next flag")
        void testListStopsAtFlag() {
            assertTrue(parser.parse("--port", "80", "443", "-f"));
            assertEquals(List.of(80, 443), ports.values());
            assertTrue(force.isSet());
        }

        @Test
        @DisplayName("Repeated list option appends")
        void testListAppends() {
            assertTrue(parser.parse("-p", "80", "--force", "-p", "8080", "8443"));
            assertEquals(List.of(80, 8080, 8443), ports.values());
        }

        @Test
        @DisplayName("Absent list is empty and not present")
        void testAbsentList() {
            assertTrue(parser.parse("-f"));
            assertTrue(ports.values().isEmpty());
            assertFalse(ports.isPresent());
        }

        @Test
        @DisplayName("List with a bad element stores nothing")
        void testListConversionFailure() {
            ParseException e = parseFailure("--port", "80", "http");
            assertEquals(ParseException.Kind.CONVERSION_FAILURE, e.getKind());
            assertEquals("http", e.getToken());
            assertInstanceOf(NumberFormatException.class, e.getCause());
            assertFalse(ports.isPresent());
        }

        @Test
        @DisplayName("List option without values is a missing value")
        void testListMissingValue() {
            assertEquals(ParseException.Kind.MISSING_VALUE, parseFailure("-p", "-f").getKind());
        }

        @Test
        @DisplayName("Values are unmodifiable")
        void testUnmodifiableValues() {
            assertTrue(parser.parse("-p", "1"));
            assertThrows(UnsupportedOperationException.class, () -> ports.values().add(2));
        }
    }

    // ========== Positionals ==========

    @Nested
    @DisplayName("Required arguments")
    class Required {

        @Test
        @DisplayName("Integer positional binds 42")
        void testRequiredInteger() {
            ValueArgument<Integer> count = parser.addRequiredValue("count", ValueType.INTEGER, "Count");

            assertTrue(parser.parse("42"));
            assertEquals(42, count.value().orElseThrow());
        }

        @Test
        @DisplayName("Non-numeric text is a conversion failure")
        void testConversionFailure() {
            parser.addRequiredValue("count", ValueType.INTEGER, "Count");

            ParseException e = parseFailure("abc");
            assertEquals(ParseException.Kind.CONVERSION_FAILURE, e.getKind());
            assertEquals("abc", e.getToken());
            assertEquals("<count>", e.getArgument());
        }

        @Test
        @DisplayName("Empty command line leaves the positional unsatisfied")
        void testUnsatisfied() {
            parser.addRequiredValue("count", ValueType.INTEGER, "Count");

            ParseException e = parseFailure();
            assertEquals(ParseException.Kind.UNSATISFIED_REQUIRED, e.getKind());
            assertEquals("<count>", e.getArgument());
            assertEquals("tool", e.getCommandPath());
        }

        @Test
        @DisplayName("Positionals fill in declared order")
        void testDeclaredOrder() {
            ValueArgument<String> source = parser.addRequiredValue("source", ValueType.STRING, "Source");
            ValueArgument<Integer> copies = parser.addRequiredValue("copies", ValueType.INTEGER, "Copies");

            assertTrue(parser.parse("a.txt", "3"));
            assertEquals("a.txt", source.value().orElseThrow());
            assertEquals(3, copies.value().orElseThrow());
        }

        @Test
        @DisplayName("Second positional missing names that slot")
        void testSecondMissing() {
            parser.addRequiredValue("source", ValueType.STRING, "Source");
            parser.addRequiredValue("target", ValueType.STRING, "Target");

            ParseException e = parseFailure("a.txt");
            assertEquals(ParseException.Kind.UNSATISFIED_REQUIRED, e.getKind());
            assertEquals("<target>", e.getArgument());
        }

        @Test
        @DisplayName("List positional stops before a flag")
        void testListStopsBeforeFlag() {
            ListArgument<String> items = parser.addRequiredList("items", ValueType.STRING, "Items");
            FlagOption flag = parser.addFlag(Command.NO_SHORT, "flag", "Flag");

            assertTrue(parser.parse("a", "b", "--flag"));
            assertEquals(List.of("a", "b"), items.values());
            assertTrue(flag.isSet());
        }

        @Test
        @DisplayName("Options may appear between positionals")
        void testInterleaved() {
            ValueArgument<String> source = parser.addRequiredValue("source", ValueType.STRING, "Source");
            ListArgument<String> rest = parser.addRequiredList("rest", ValueType.STRING, "Rest");
            FlagOption verbose = parser.addFlag('v', "verbose", "Verbose");

            assertTrue(parser.parse("-v", "in", "x", "y", "-v"));
            assertEquals("in", source.value().orElseThrow());
            assertEquals(List.of("x", "y"), rest.values());
            assertEquals(2, verbose.count());
        }

        @Test
        @DisplayName("Token beyond the positionals is unexpected")
        void testUnexpectedToken() {
            parser.addRequiredValue("file", ValueType.STRING, "File");

            ParseException e = parseFailure("a", "b");
            assertEquals(ParseException.Kind.UNEXPECTED_TOKEN, e.getKind());
            assertEquals("b", e.getToken());
        }

        @Test
        @DisplayName("Lone dash is a positional")
        void testLoneDash() {
            ValueArgument<String> file = parser.addRequiredValue("file", ValueType.STRING, "File");

            assertTrue(parser.parse("-"));
            assertEquals("-", file.value().orElseThrow());
        }

        @Test
        @DisplayName("Negative numbers are values")
        void testNegativeNumbers() {
            ValueArgument<Integer> offset = parser.addRequiredValue("offset", ValueType.INTEGER, "Offset");
            ValueOption<Double> scale = parser.addValue('s', "scale", ValueType.DOUBLE, "Scale");

            assertTrue(parser.parse("-5", "--scale", "-0.5"));
            assertEquals(-5, offset.value().orElseThrow());
            assertEquals(-0.5, scale.value().orElseThrow());
        }

        @Test
        @DisplayName("Digit short flag turns -1 into a flag")
        void testDigitShortFlag() {
            FlagOption one = parser.addFlag('1', "single", "One per line");
            parser.addRequiredValue("offset", ValueType.INTEGER, "Offset");

            ParseException e = parseFailure("-1");
            assertEquals(ParseException.Kind.UNSATISFIED_REQUIRED, e.getKind());
            assertEquals(1, one.count());
        }

        @Test
        @DisplayName("Tokens after -- are positionals")
        void testEndOfOptions() {
            ListArgument<String> files = parser.addRequiredList("files", ValueType.STRING, "Files");
            FlagOption verbose = parser.addFlag('v', "verbose", "Verbose");

            assertTrue(parser.parse("-v", "--", "-v", "--verbose", "x"));
            assertEquals(List.of("-v", "--verbose", "x"), files.values());
            assertEquals(1, verbose.count());
        }

        @Test
        @DisplayName("List positional continues after --")
        void testListAcrossEndOfOptions() {
            ListArgument<String> files = parser.addRequiredList("files", ValueType.STRING, "Files");

            assertTrue(parser.parse("a", "--", "-b"));
            assertEquals(List.of("a", "-b"), files.values());
        }

        @Test
        @DisplayName("Flag before -- still counts when a list straddles it")
        void testListAcrossEndOfOptionsWithFlag() {
            FlagOption force = parser.addFlag('f', "force", "Force");
            ListArgument<String> files = parser.addRequiredList("files", ValueType.STRING, "Files");

            assertTrue(parser.parse("-f", "a", "b", "--", "--force", "c"));
            assertEquals(List.of("a", "b", "--force", "c"), files.values());
            assertEquals(1, force.count());
        }

        @Test
        @DisplayName("Trailing -- after a list is dropped")
        void testTrailingEndOfOptions() {
            ListArgument<String> files = parser.addRequiredList("files", ValueType.STRING, "Files");

            assertTrue(parser.parse("a", "--"));
            assertEquals(List.of("a"), files.values());
        }
    }

    // ========== Subcommands ==========

    @Nested
    @DisplayName("Subcommands")
    class Subcommands {

        private Command child;
        private ValueArgument<Integer> x;

        @BeforeEach
        void setUp() {
            child = parser.addCommand("child", "Child command");
            x = child.addRequiredValue("x", ValueType.INTEGER, "X");
        }

        @Test
        @DisplayName("child 7 binds x in the child")
        void testChild() {
            assertTrue(parser.parse("child", "7"));
            assertEquals(7, x.value().orElseThrow());
            assertTrue(child.isInvoked());
            assertEquals(List.of("tool", "child"), parser.invokedPath());
            assertSame(child, parser.deepestInvoked());
        }

        @Test
        @DisplayName("Unknown subcommand is unexpected")
        void testUnknownSubcommand() {
            ParseException e = parseFailure("unknown", "7");
            assertEquals(ParseException.Kind.UNEXPECTED_TOKEN, e.getKind());
            assertEquals("unknown", e.getToken());
            assertEquals("tool", e.getCommandPath());
            assertFalse(child.isInvoked());
        }

        @Test
        @DisplayName("Missing positional is scoped to the child")
        void testChildUnsatisfied() {
            ParseException e = parseFailure("child");
            assertEquals(ParseException.Kind.UNSATISFIED_REQUIRED, e.getKind());
            assertEquals("tool child", e.getCommandPath());
            assertEquals("<x>", e.getArgument());
            assertSame(child, parser.deepestInvoked());
            assertTrue(e.getMessage().startsWith("tool child: "), e.getMessage());
        }

        @Test
        @DisplayName("Tokens after the subcommand belong to it")
        void testSubcommandIsExclusive() {
            FlagOption verbose = parser.addFlag('v', "verbose", "Verbose");

            ParseException e = parseFailure("child", "1", "-v");
            assertEquals(ParseException.Kind.UNKNOWN_OPTION, e.getKind());
            assertEquals("tool child", e.getCommandPath());
            assertFalse(verbose.isSet());
        }

        @Test
        @DisplayName("Root options go before the subcommand name")
        void testRootOptionBeforeSubcommand() {
            FlagOption verbose = parser.addFlag('v', "verbose", "Verbose");

            assertTrue(parser.parse("-v", "child", "1"));
            assertTrue(verbose.isSet());
            assertEquals(1, x.value().orElseThrow());
        }

        @Test
        @DisplayName("Root positionals are filled before subcommand names match")
        void testPositionalBeforeSubcommand() {
            ValueArgument<String> target = parser.addRequiredValue("target", ValueType.STRING, "Target");

            assertTrue(parser.parse("child", "child", "3"));
            assertEquals("child", target.value().orElseThrow());
            assertEquals(3, x.value().orElseThrow());
        }

        @Test
        @DisplayName("Nested subcommands")
        void testNested() {
            Command remote = parser.addCommand("remote", "Remotes");
            Command add = remote.addCommand("add", "Add");
            ValueArgument<String> name = add.addRequiredValue("name", ValueType.STRING, "Name");
            FlagOption fetch = add.addFlag('f', "fetch", "Fetch");

            assertTrue(parser.parse("remote", "add", "-f", "origin"));
            assertEquals("origin", name.value().orElseThrow());
            assertTrue(fetch.isSet());
            assertEquals(List.of("tool", "remote", "add"), parser.invokedPath());
            assertFalse(child.isInvoked());
        }

        @Test
        @DisplayName("-- carries into the subcommand")
        void testEndOfOptionsInSubcommand() {
            Command echo = parser.addCommand("echo", "Echo");
            ListArgument<String> words = echo.addRequiredList("words", ValueType.STRING, "Words");

            assertTrue(parser.parse("--", "echo", "-n", "hi"));
            assertEquals(List.of("-n", "hi"), words.values());
        }
    }

    // ========== Parser lifecycle ==========

    @Test
    @DisplayName("Failed parse keeps the error")
    void testErrorKept() {
        parser.addRequiredValue("file", ValueType.STRING, "File");

        assertTrue(parser.error().isEmpty());
        assertFalse(parser.parse());
        assertEquals(ParseException.Kind.UNSATISFIED_REQUIRED, parser.error().orElseThrow().getKind());
        assertFalse(parser.isParsed());
    }

    @Test
    @DisplayName("Successful parse has no error")
    void testSuccess() {
        assertTrue(parser.parse());
        assertTrue(parser.isParsed());
        assertTrue(parser.error().isEmpty());
        assertTrue(parser.isInvoked());
    }

    @Test
    @DisplayName("Parsing twice is rejected")
    void testSecondParse() {
        parser.addList('i', "include", ValueType.STRING, "Includes");

        assertTrue(parser.parse("-i", "a"));
        assertThrows(IllegalStateException.class, () -> parser.parse("-i", "b"));
        assertEquals(List.of("a"), parser.getList("include", String.class).values());
    }

    @Test
    @DisplayName("parseArgv skips the program name")
    void testParseArgv() {
        ValueArgument<String> file = parser.addRequiredValue("file", ValueType.STRING, "File");

        assertTrue(parser.parseArgv(new String[]{"/usr/bin/tool", "data.csv"}));
        assertEquals("data.csv", file.value().orElseThrow());
    }

    @Test
    @DisplayName("parseArgv with an empty vector")
    void testParseArgvEmpty() {
        assertTrue(parser.parseArgv(new String[0]));
    }

    @Test
    @DisplayName("Repeated retrieval returns the same value")
    void testIdempotentRetrieval() {
        ValueOption<Integer> level = parser.addValue('l', "level", ValueType.INTEGER, "Level");
        ListArgument<String> files = parser.addRequiredList("files", ValueType.STRING, "Files");

        assertTrue(parser.parse("-l", "3", "a", "b"));
        for (int i = 0; i < 3; i++) {
            assertEquals(3, level.value().orElseThrow());
            assertEquals(List.of("a", "b"), files.values());
            assertSame(level, parser.getValue("level", Integer.class));
        }
    }
}
