package com.tpanalyzer.core.renderer.impl;

import com.tpanalyzer.core.renderer.GeneratedFile;
import com.tpanalyzer.core.renderer.GeneratedOutput;
import com.tpanalyzer.core.renderer.OutputRenderer;
import com.tpanalyzer.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Prints generated files to a stream, each preceded by a header with its path.
 *
 * <p>Used for {@code --dry-run} and for the {@code flow} command without an output
 * directory. Settings: {@code console.separator} (default {@code ---}) and
 * {@code console.showHeaders} (default {@code true}).
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String DEFAULT_SEPARATOR = "---";
    private static final int LINE_WIDTH = 80;

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        String separator = context.getSettingOrDefault("console.separator", DEFAULT_SEPARATOR);
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault("console.showHeaders", "true"));
        String rule = separator.repeat(Math.max(1, LINE_WIDTH / Math.max(1, separator.length())));

        logger.debug("Printing {} report files", output.files().size());

        for (GeneratedFile file : output.files()) {
            if (showHeaders) {
                out.println(rule);
                out.println(file.relativePath() + " (" + file.content().length() + " characters)");
                out.println(rule);
            }
            out.println(file.content());
        }
        out.flush();
    }
}
