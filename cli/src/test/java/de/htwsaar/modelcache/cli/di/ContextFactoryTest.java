package de.htwsaar.modelcache.cli.di;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import de.htwsaar.modelcache.cli.command.ModelCacheRootCommand;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.junit.jupiter.api.Test;

class ContextFactoryTest {

    @Test
    void injectsContextIntoCommandsAndFallsBackOtherwise() throws Exception {
        try (Terminal terminal = TerminalBuilder.builder()
                .system(false)
                .type(Terminal.TYPE_DUMB)
                .streams(InputStream.nullInputStream(), OutputStream.nullOutputStream())
                .build()) {
            CliContext ctx = new CliContext(
                    terminal, new PrintWriter(new StringWriter()), new PrintWriter(new StringWriter()), Clock.systemUTC());
            ContextFactory factory = new ContextFactory(ctx);

            assertNotNull(factory.create(ModelCacheRootCommand.class));
            assertSame(StringBuilder.class, factory.create(StringBuilder.class).getClass());
        }
    }
}
