package io.github.yok.xmlcsvlink.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code markup} section in {@code application.yml}.
 *
 * <p>
 * Controls how markup text is read by the lexer/parser and written by the serializer. All defaults
 * reproduce the fixed output of the converter, so an empty configuration is valid.
 * </p>
 *
 * <pre>
 * markup:
 *   declaration: '&lt;?xml version="1.0"?&gt;'
 *   indent: "  "
 *   root-name: root
 *   document-element-name: root2
 *   record-element-name: element
 *   fail-on-unclosed-tags: false
 *   charset: UTF-8
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "markup")
@Data
public class MarkupConfig {

    /**
     * Declaration line written before the first element.
     */
    private String declaration = "<?xml version=\"1.0\"?>";

    /**
     * Indentation unit repeated once per nesting level.
     */
    private String indent = "  ";

    /**
     * Name of the synthetic node that wraps every parsed or ingested tree.
     */
    private String rootName = "root";

    /**
     * Name of the document element created when importing tabular data.
     */
    private String documentElementName = "root2";

    /**
     * Name of the element created for each imported row.
     */
    private String recordElementName = "element";

    /**
     * When {@code true}, elements still open at end of input make parsing fail. Defaults to
     * {@code false} (accepted with a warning).
     */
    private boolean failOnUnclosedTags = false;

    /**
     * Charset used to read and write markup files.
     */
    private String charset = "UTF-8";
}
