package com.agilab.model_ingestion.decode;

import com.agilab.model_ingestion.config.IngestionOptions;
import com.agilab.model_ingestion.data.XmlDocument;
import com.agilab.model_ingestion.exception.DatasetReadException;
import com.agilab.model_ingestion.util.FileOperations;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Parses XML model documents into an {@link XmlDocument} handle.
 *
 * <p>Only {@code namespace}, {@code ignore_comments} and {@code model} are read from the options;
 * any other option is dropped without complaint.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class XmlDecoder implements DatasetDecoder {

    static final Set<String> PARAMETERS = Set.of(
            IngestionOptions.NAMESPACE,
            IngestionOptions.IGNORE_COMMENTS,
            IngestionOptions.MODEL);

    private final FileOperations fileOperations;

    @Override
    public String formatTag() {
        return "xml";
    }

    @Override
    public Object decode(Path path, IngestionOptions options) {
        var parameters = options.only(PARAMETERS);
        var namespace = parameters.getString(IngestionOptions.NAMESPACE).orElse(null);
        var ignoreComments = parameters.getBoolean(IngestionOptions.IGNORE_COMMENTS, true);
        log.trace("Parsing {} with {}", path, parameters);

        var document = fileOperations.readWithRetry(path, file -> parse(file, namespace != null, ignoreComments));
        return new XmlDocument(path, document, namespace, parameters.getString(IngestionOptions.MODEL).orElse(null));
    }

    private static Document parse(Path path, boolean namespaceAware, boolean ignoreComments) throws IOException {
        try {
            var factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(namespaceAware);
            factory.setIgnoringComments(ignoreComments);
            factory.setExpandEntityReferences(false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            return factory.newDocumentBuilder().parse(path.toFile());
        } catch (ParserConfigurationException | SAXException e) {
            throw new DatasetReadException(path.toString(), "Malformed XML in " + path + ": " + e.getMessage(), e);
        }
    }
}
