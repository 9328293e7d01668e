package info.isaksson.erland.fmuhandler.xml;

import info.isaksson.erland.fmuhandler.error.MalformedXmlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.transform.stream.StreamSource;
import javax.xml.validation.Schema;
import javax.xml.validation.SchemaFactory;
import javax.xml.validation.Validator;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates model description documents against an XML Schema.
 *
 * <p>The compiled {@link Schema} is immutable and safe to share; a fresh {@link Validator} is
 * created per call. {@link #fmi2()} returns the process-wide validator for the bundled FMI 2.0
 * schema, compiled on first use.</p>
 */
public final class SchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);

    public static final String FMI2_SCHEMA_RESOURCE = "/schema/fmi2ModelDescription.xsd";

    private final Schema schema;
    private final String schemaLocation;

    private SchemaValidator(Schema schema, String schemaLocation) {
        this.schema = schema;
        this.schemaLocation = schemaLocation;
    }

    private static final class Fmi2Holder {
        static final SchemaValidator INSTANCE = fromResource(SchemaValidator.class.getResource(FMI2_SCHEMA_RESOURCE));
    }

    public static SchemaValidator fmi2() {
        return Fmi2Holder.INSTANCE;
    }

    public static SchemaValidator fromResource(URL schemaUrl) {
        if (schemaUrl == null) throw new IllegalArgumentException("schemaUrl must not be null (schema resource missing?)");
        try {
            SchemaFactory factory = SchemaFactory.newInstance(XMLConstants.W3C_XML_SCHEMA_NS_URI);
            Schema schema = factory.newSchema(schemaUrl);
            log.debug("Compiled XML schema {}", schemaUrl);
            return new SchemaValidator(schema, schemaUrl.toString());
        } catch (SAXException e) {
            throw new IllegalStateException("Could not compile XML schema " + schemaUrl, e);
        }
    }

    public String schemaLocation() {
        return schemaLocation;
    }

    /**
     * Validate a serialized document. Invalid content is reported in the result, never thrown.
     *
     * @throws MalformedXmlException if the input is not well-formed
     */
    public ValidationResult validate(byte[] xml) {
        if (xml == null) throw new IllegalArgumentException("xml must not be null");

        List<ValidationDiagnostic> diagnostics = new ArrayList<>();
        Validator validator = schema.newValidator();
        validator.setErrorHandler(new ErrorHandler() {
            @Override
            public void warning(SAXParseException e) {
                diagnostics.add(diagnostic(ValidationDiagnostic.Severity.WARNING, e));
            }

            @Override
            public void error(SAXParseException e) {
                diagnostics.add(diagnostic(ValidationDiagnostic.Severity.ERROR, e));
            }

            @Override
            public void fatalError(SAXParseException e) throws SAXException {
                throw e;
            }
        });

        try {
            validator.validate(new StreamSource(new ByteArrayInputStream(xml)));
        } catch (SAXParseException e) {
            throw new MalformedXmlException("Document is not well-formed: " + e.getMessage(),
                    e.getLineNumber(), e.getColumnNumber(), e);
        } catch (SAXException e) {
            throw new MalformedXmlException("Document is not well-formed: " + e.getMessage(), -1, -1, e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }

        ValidationResult result = new ValidationResult(diagnostics);
        if (!result.valid) {
            log.debug("Schema validation failed: {}", result.summary());
        }
        return result;
    }

    private static ValidationDiagnostic diagnostic(ValidationDiagnostic.Severity severity, SAXParseException e) {
        return new ValidationDiagnostic(severity, e.getLineNumber(), e.getColumnNumber(),
                e.getMessage() == null ? e.toString() : e.getMessage());
    }
}
