package io.github.yok.xmlcsvlink.core;

import com.google.common.base.Preconditions;
import io.github.yok.xmlcsvlink.config.MarkupConfig;
import io.github.yok.xmlcsvlink.config.TableConfig;
import io.github.yok.xmlcsvlink.model.Node;
import io.github.yok.xmlcsvlink.model.Term;
import io.github.yok.xmlcsvlink.parser.ConversionException;
import io.github.yok.xmlcsvlink.parser.MarkupLexer;
import io.github.yok.xmlcsvlink.parser.TreeParser;
import java.nio.charset.Charset;
import java.util.List;

/**
 * Export direction: markup file to tabular file.
 *
 * <p>
 * Pipeline: {@link MarkupLexer} &rarr; {@link TreeParser} &rarr; {@link TableProjector}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class MarkupToTableConverter extends AbstractConverter {

    private final MarkupConfig markupConfig;
    private final TableConfig tableConfig;
    private final MarkupLexer lexer;
    private final TreeParser parser;
    private final TableProjector projector;

    /**
     * Creates the converter.
     *
     * @param markupConfig markup settings
     * @param tableConfig tabular settings
     * @param notifier user-facing notification channel
     */
    public MarkupToTableConverter(MarkupConfig markupConfig, TableConfig tableConfig,
            StatusNotifier notifier) {
        super(notifier);
        this.markupConfig = Preconditions.checkNotNull(markupConfig, "markupConfig");
        this.tableConfig = Preconditions.checkNotNull(tableConfig, "tableConfig");
        this.lexer = new MarkupLexer();
        this.parser = new TreeParser(markupConfig);
        this.projector = new TableProjector(tableConfig);
    }

    @Override
    protected String transform(String text) throws ConversionException {
        List<Term> terms = lexer.tokenize(text);
        notifier.info("Completed lexical analysis");

        Node root = parser.parse(terms);
        notifier.info("Completed parsing");

        String csv = projector.project(root);
        notifier.info("Completed CSV formatting");
        return csv;
    }

    @Override
    public DataFormat getSourceFormat() {
        return DataFormat.XML;
    }

    @Override
    public DataFormat getTargetFormat() {
        return DataFormat.CSV;
    }

    @Override
    protected Charset getSourceCharset() {
        return Charset.forName(markupConfig.getCharset());
    }

    @Override
    protected Charset getTargetCharset() {
        return Charset.forName(tableConfig.getCharset());
    }
}
