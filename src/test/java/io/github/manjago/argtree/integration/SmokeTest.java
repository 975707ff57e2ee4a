package io.github.manjago.argtree.integration;

import io.github.manjago.argtree.core.ArgumentParser;
import io.github.manjago.argtree.core.Command;
import io.github.manjago.argtree.core.FlagOption;
import io.github.manjago.argtree.core.ListArgument;
import io.github.manjago.argtree.core.ListOption;
import io.github.manjago.argtree.core.ParseException;
import io.github.manjago.argtree.core.ValueArgument;
import io.github.manjago.argtree.core.ValueOption;
import io.github.manjago.argtree.core.ValueType;
import io.github.manjago.argtree.help.UsageFormatter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end use of the library the way a tool would use it.
 */
@DisplayName("Smoke Tests")
class SmokeTest {

    private ArgumentParser docker;
    private FlagOption debug;
    private Command run;
    private ListOption<String> env;
    private ValueOption<Integer> memory;
    private FlagOption detach;
    private ValueArgument<String> image;
    private ListArgument<String> command;
    private Command cp;
    private ValueArgument<Path> source;
    private ValueArgument<Path> target;

    @BeforeEach
    void setUp() {
        docker = new ArgumentParser("docker", "Container runtime");
        debug = docker.addFlag('D', "debug", "Debug output");

        run = docker.addCommand("run", "Run a container");
        env = run.addList('e', "env", ValueType.STRING, "Environment variables");
        memory = run.addValue('m', "memory", ValueType.INTEGER, "Memory limit in MB");
        detach = run.addFlag('d', "detach", "Run in background");
        run.addFlag('i', "interactive", "Keep stdin open");
        run.addFlag('t', "tty", "Allocate a terminal");
        image = run.addRequiredValue("image", ValueType.STRING, "Image");
        command = run.addRequiredList("command", ValueType.STRING, "Command to run");

        cp = docker.addCommand("cp", "Copy files");
        source = cp.addRequiredValue("source", ValueType.PATH, "Source");
        target = cp.addRequiredValue("target", ValueType.PATH, "Target");
    }

    @Test
    @DisplayName("Full run command line")
    void testRun() {
        boolean ok = docker.parseArgv(new String[]{
                "docker", "-D", "run", "-it", "-e", "A=1", "B=2", "--memory", "512", "-d",
                "alpine", "--", "sh", "-c", "echo hi"
        });

        assertTrue(ok, () -> docker.error().map(Throwable::getMessage).orElse(""));
        assertTrue(debug.isSet());
        assertTrue(run.isInvoked());
        assertFalse(cp.isInvoked());
        assertTrue(run.getFlag("interactive").isSet());
        assertTrue(run.getFlag("tty").isSet());
        assertTrue(detach.isSet());
        assertEquals(List.of("A=1", "B=2"), env.values());
        assertEquals(512, memory.value().orElseThrow());
        assertEquals("alpine", image.value().orElseThrow());
        assertEquals(List.of("sh", "-c", "echo hi"), command.values());
    }

    @Test
    @DisplayName("Lone dash stays in the positional list")
    void testLoneDash() {
        assertTrue(docker.parse("run", "alpine", "cat", "-", "-d"));
        assertEquals(List.of("cat", "-"), command.values());
        assertTrue(detach.isSet());
    }

    @Test
    @DisplayName("Failure points at the subcommand and its usage")
    void testFailureUsage() {
        assertFalse(docker.parse("cp", "a.txt"));

        ParseException error = docker.error().orElseThrow();
        assertEquals(ParseException.Kind.UNSATISFIED_REQUIRED, error.getKind());
        assertSame(cp, docker.deepestInvoked());
        assertEquals("a.txt", source.value().orElseThrow().toString());
        assertFalse(target.isPresent());

        String usage = new UsageFormatter().format(docker.deepestInvoked());
        assertTrue(usage.startsWith("usage: docker cp <source> <target>"), usage);
    }

    @Test
    @DisplayName("Grouping a value option fails")
    void testGroupedValueOption() {
        assertFalse(docker.parse("run", "-dm", "512", "alpine", "sh"));
        assertEquals(ParseException.Kind.AMBIGUOUS_SHORT_GROUP, docker.error().orElseThrow().getKind());
    }
}
