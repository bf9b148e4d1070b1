package com.example.letters.infrastructure.pdf;

import com.example.letters.domain.model.DocumentProperties;
import com.example.letters.domain.model.FontFace;
import com.example.letters.domain.model.LineStyle;
import com.example.letters.domain.model.RgbColor;
import com.example.letters.domain.render.DrawingSurface;
import com.example.letters.infrastructure.exception.SurfaceException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * {@link DrawingSurface} backed by an in-memory PDFBox document.
 * Every PDFBox {@link IOException} surfaces as a {@link SurfaceException}.
 */
public class PdfBoxDrawingSurface implements DrawingSurface {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxDrawingSurface.class);
    private static final float[] DASH_PATTERN = {3f, 2f};
    private static final float[] SOLID_PATTERN = {};

    private final PDDocument document = new PDDocument();
    private final PdfBoxFonts fonts = new PdfBoxFonts();
    private final PDRectangle pageBox;
    private final DocumentProperties properties;
    private final PdfBoxDocumentPropertiesWriter propertiesWriter;

    private PDPageContentStream stream;
    private int substitutions;
    private boolean closed;

    /**
     * @param pageBox          media box of every page, in points
     * @param properties       metadata written when the document is finished
     * @param propertiesWriter writer for the info dictionary and XMP packet
     */
    public PdfBoxDrawingSurface(PDRectangle pageBox, DocumentProperties properties,
                                PdfBoxDocumentPropertiesWriter propertiesWriter) {
        this.pageBox = pageBox;
        this.properties = properties;
        this.propertiesWriter = propertiesWriter;
    }

    @Override
    public void newPage() {
        try {
            closeStream();
            PDPage page = new PDPage(pageBox);
            document.addPage(page);
            stream = new PDPageContentStream(document, page);
        } catch (IOException e) {
            throw new SurfaceException("Unable to start page " + (document.getNumberOfPages() + 1), e);
        }
    }

    @Override
    public void drawText(double x, double y, String text, FontFace face, double size, RgbColor color) {
        String printable = PdfBoxFonts.sanitize(text);
        if (!printable.equals(text)) {
            substitutions++;
        }
        try {
            PDPageContentStream contentStream = requireStream();
            contentStream.beginText();
            contentStream.setFont(fonts.font(face), (float) size);
            contentStream.setNonStrokingColor(color.redFraction(), color.greenFraction(), color.blueFraction());
            contentStream.newLineAtOffset((float) x, (float) y);
            contentStream.showText(printable);
            contentStream.endText();
        } catch (IOException e) {
            throw new SurfaceException("Unable to draw text on page " + document.getNumberOfPages(), e);
        }
    }

    @Override
    public void drawLine(double x1, double y1, double x2, double y2, RgbColor color, double width, LineStyle style) {
        try {
            PDPageContentStream contentStream = requireStream();
            contentStream.setStrokingColor(color.redFraction(), color.greenFraction(), color.blueFraction());
            contentStream.setLineWidth((float) width);
            contentStream.setLineDashPattern(style == LineStyle.DASHED ? DASH_PATTERN : SOLID_PATTERN, 0);
            contentStream.moveTo((float) x1, (float) y1);
            contentStream.lineTo((float) x2, (float) y2);
            contentStream.stroke();
        } catch (IOException e) {
            throw new SurfaceException("Unable to draw line on page " + document.getNumberOfPages(), e);
        }
    }

    @Override
    public int pageCount() {
        return document.getNumberOfPages();
    }

    @Override
    public byte[] finish() {
        try (ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            closeStream();
            propertiesWriter.write(document, properties);
            document.save(outputStream);
            if (substitutions > 0) {
                log.warn("Replaced unsupported characters in {} line(s) of '{}'", substitutions, properties.title());
            }
            return outputStream.toByteArray();
        } catch (IOException e) {
            throw new SurfaceException("Unable to save the letter PDF", e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            closeStream();
        } catch (IOException e) {
            log.debug("Content stream was already unusable while closing", e);
        }
        try {
            document.close();
        } catch (IOException e) {
            throw new SurfaceException("Unable to release the letter PDF", e);
        }
    }

    private PDPageContentStream requireStream() {
        if (stream == null) {
            throw new IllegalStateException("newPage() must be called before drawing");
        }
        return stream;
    }

    private void closeStream() throws IOException {
        if (stream != null) {
            PDPageContentStream current = stream;
            stream = null;
            current.close();
        }
    }
}
