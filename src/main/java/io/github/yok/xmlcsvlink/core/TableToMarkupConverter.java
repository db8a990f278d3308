package io.github.yok.xmlcsvlink.core;

import com.google.common.base.Preconditions;
import io.github.yok.xmlcsvlink.config.MarkupConfig;
import io.github.yok.xmlcsvlink.config.TableConfig;
import io.github.yok.xmlcsvlink.model.Node;
import io.github.yok.xmlcsvlink.model.Term;
import io.github.yok.xmlcsvlink.parser.ConversionException;
import java.nio.charset.Charset;
import java.util.List;

/**
 * Import direction: tabular file to markup file.
 *
 * <p>
 * Pipeline: {@link TableIngestor} &rarr; {@link TreeSerializer}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class TableToMarkupConverter extends AbstractConverter {

    private final MarkupConfig markupConfig;
    private final TableConfig tableConfig;
    private final TableIngestor ingestor;
    private final TreeSerializer serializer;

    /**
     * Creates the converter.
     *
     * @param markupConfig markup settings
     * @param tableConfig tabular settings
     * @param notifier user-facing notification channel
     */
    public TableToMarkupConverter(MarkupConfig markupConfig, TableConfig tableConfig,
            StatusNotifier notifier) {
        super(notifier);
        this.markupConfig = Preconditions.checkNotNull(markupConfig, "markupConfig");
        this.tableConfig = Preconditions.checkNotNull(tableConfig, "tableConfig");
        this.ingestor = new TableIngestor(markupConfig, tableConfig);
        this.serializer = new TreeSerializer(markupConfig);
    }

    @Override
    protected String transform(String text) throws ConversionException {
        Node root = ingestor.ingest(text);

        List<Term> terms = serializer.serialize(root);
        notifier.info("Completed XML reverse parsing");

        String xml = serializer.render(terms);
        notifier.info("Completed XML formatting");
        return xml;
    }

    @Override
    public DataFormat getSourceFormat() {
        return DataFormat.CSV;
    }

    @Override
    public DataFormat getTargetFormat() {
        return DataFormat.XML;
    }

    @Override
    protected Charset getSourceCharset() {
        return Charset.forName(tableConfig.getCharset());
    }

    @Override
    protected Charset getTargetCharset() {
        return Charset.forName(markupConfig.getCharset());
    }
}
