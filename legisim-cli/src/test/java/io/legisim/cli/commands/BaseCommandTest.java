package io.legisim.cli.commands;

import io.legisim.core.session.OutcomeRecord;
import io.legisim.core.sweep.OutcomeTable;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.lang.reflect.Field;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

/// Base class for CLI command tests with common utilities.
abstract class BaseCommandTest {

    protected ByteArrayOutputStream outContent;
    protected ByteArrayOutputStream errContent;
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void setUpStreams() {
        originalOut = System.out;
        originalErr = System.err;
        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(errContent, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    /// Injects a value into a field, searching up the class hierarchy.
    protected void injectField(Object target, String fieldName, Object value) throws Exception {
        Field field = findField(target.getClass(), fieldName);
        field.setAccessible(true);
        field.set(target, value);
    }

    private Field findField(Class<?> clazz, String fieldName) throws NoSuchFieldException {
        Class<?> current = clazz;
        while (current != null) {
            try {
                return current.getDeclaredField(fieldName);
            } catch (NoSuchFieldException e) {
                current = current.getSuperclass();
            }
        }
        throw new NoSuchFieldException(fieldName);
    }

    protected String output() {
        return outContent.toString(StandardCharsets.UTF_8);
    }

    protected String errors() {
        return errContent.toString(StandardCharsets.UTF_8);
    }

    /// Runs the top-level command line and returns its exit code.
    protected int execute(String... args) {
        return LegisimCLI.commandLine().execute(args);
    }

    /// Creates a table whose vote count is `2 * distance + 1`, alternating the sign of
    /// the opening proposal.
    protected OutcomeTable createLinearTable(int rows) {
        List<OutcomeRecord> records = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            double distance = i * 0.5;
            double initial = i % 2 == 0 ? -0.2 : 0.2;
            records.add(
                    new OutcomeRecord(
                            i + 1,
                            initial,
                            0.0,
                            (int) (2 * distance + 1),
                            51,
                            51,
                            distance,
                            0.1,
                            0.01,
                            0.1,
                            0.01));
        }
        return OutcomeTable.of(records);
    }
}
