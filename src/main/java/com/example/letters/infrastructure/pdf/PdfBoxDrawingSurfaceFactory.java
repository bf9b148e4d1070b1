package com.example.letters.infrastructure.pdf;

import com.example.letters.domain.layout.Units;
import com.example.letters.domain.model.DocumentProperties;
import com.example.letters.domain.model.PageSize;
import com.example.letters.domain.render.DrawingSurface;
import com.example.letters.domain.render.DrawingSurfaceFactory;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.springframework.stereotype.Component;

/**
 * Opens a new in-memory PDFBox document per letter.
 */
@Component
public class PdfBoxDrawingSurfaceFactory implements DrawingSurfaceFactory {

    private final PdfBoxDocumentPropertiesWriter propertiesWriter;

    public PdfBoxDrawingSurfaceFactory(PdfBoxDocumentPropertiesWriter propertiesWriter) {
        this.propertiesWriter = propertiesWriter;
    }

    @Override
    public DrawingSurface open(PageSize pageSize, DocumentProperties properties) {
        PDRectangle pageBox = new PDRectangle((float) Units.inches(pageSize.width()), (float) Units.inches(pageSize.height()));
        return new PdfBoxDrawingSurface(pageBox, properties, propertiesWriter);
    }
}
