package com.example.letters.infrastructure.pdf;

import com.example.letters.domain.model.DocumentProperties;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentCatalog;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.DublinCoreSchema;
import org.apache.xmpbox.schema.XMPBasicSchema;
import org.apache.xmpbox.xml.XmpSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.xml.transform.TransformerException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Calendar;
import java.util.GregorianCalendar;
import java.util.TimeZone;

/**
 * Infrastructure helper that stores letter metadata in a PDFBox document: the info dictionary, an XMP
 * packet (Dublin Core and XMP Basic) and a trailer document ID.
 * <p>
 * Every value is derived from the letter itself, never from the clock, so rendering the same letter
 * twice produces identical bytes.
 */
@Component
public class PdfBoxDocumentPropertiesWriter {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxDocumentPropertiesWriter.class);
    static final String CREATOR_TOOL = "letter-pdf";

    /**
     * Writes the metadata into the document before it is saved.
     *
     * @param document   document being built
     * @param properties letter metadata
     * @throws IOException when the XMP stream cannot be attached
     */
    public void write(PDDocument document, DocumentProperties properties) throws IOException {
        Calendar created = toCalendar(properties.creationDate());

        PDDocumentInformation info = document.getDocumentInformation();
        info.setTitle(properties.title());
        info.setAuthor(properties.author());
        info.setSubject(properties.subject());
        info.setCreator(CREATOR_TOOL);
        info.setCreationDate(created);

        writeXmp(document.getDocumentCatalog(), document, properties, created);
        writeDocumentId(document, properties);
    }

    /**
     * Serializes the XMP packet; a failure here only costs the XMP copy of the metadata.
     */
    private void writeXmp(PDDocumentCatalog catalog, PDDocument document, DocumentProperties properties,
                          Calendar created) throws IOException {
        XMPMetadata xmp = XMPMetadata.createXMPMetadata();
        DublinCoreSchema dc = xmp.createAndAddDublinCoreSchema();
        dc.setTitle(properties.title());
        if (!properties.author().isEmpty()) {
            dc.addCreator(properties.author());
        }
        if (!properties.subject().isEmpty()) {
            dc.setDescription(properties.subject());
        }
        XMPBasicSchema basic = xmp.createAndAddXMPBasicSchema();
        basic.setCreatorTool(CREATOR_TOOL);
        basic.setCreateDate(created);

        try (ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            new XmpSerializer().serialize(xmp, outputStream, true);
            PDMetadata metadata = new PDMetadata(document);
            metadata.importXMPMetadata(outputStream.toByteArray());
            catalog.setMetadata(metadata);
        } catch (TransformerException ex) {
            log.warn("Failed to serialize XMP metadata for '{}'", properties.title(), ex);
        }
    }

    private void writeDocumentId(PDDocument document, DocumentProperties properties) {
        byte[] id = digest(properties.title() + '\n' + properties.author() + '\n'
                + properties.subject() + '\n' + properties.creationDate());
        COSArray ids = new COSArray();
        ids.add(new COSString(id));
        ids.add(new COSString(id));
        document.getDocument().getTrailer().setItem(COSName.ID, ids);
    }

    private byte[] digest(String value) {
        try {
            return MessageDigest.getInstance("MD5").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 is required by every Java platform", e);
        }
    }

    private Calendar toCalendar(LocalDate date) {
        GregorianCalendar calendar = new GregorianCalendar(TimeZone.getTimeZone(ZoneOffset.UTC));
        calendar.clear();
        calendar.set(date.getYear(), date.getMonthValue() - 1, date.getDayOfMonth());
        return calendar;
    }
}
