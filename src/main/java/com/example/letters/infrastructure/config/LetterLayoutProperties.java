package com.example.letters.infrastructure.config;

import com.example.letters.domain.model.AddressPosition;
import com.example.letters.domain.model.DateAlignment;
import com.example.letters.domain.model.DatePosition;
import com.example.letters.domain.model.FoldLineStyle;
import com.example.letters.domain.model.FoldLines;
import com.example.letters.domain.model.FontFamily;
import com.example.letters.domain.model.Footer;
import com.example.letters.domain.model.Formatting;
import com.example.letters.domain.model.Header;
import com.example.letters.domain.model.HeaderContent;
import com.example.letters.domain.model.LetterConfiguration;
import com.example.letters.domain.model.LineStyle;
import com.example.letters.domain.model.Margins;
import com.example.letters.domain.model.PageSize;
import com.example.letters.domain.model.Positioning;
import com.example.letters.domain.model.RgbColor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Server-side defaults for letter layout, bound from the {@code letter.layout} prefix.
 * Unset values fall back to the domain defaults; the result is validated once at startup.
 */
@ConfigurationProperties(prefix = "letter.layout")
public class LetterLayoutProperties {

    private final Page page = new Page();
    private final MarginSettings margins = new MarginSettings();
    private final Windows windows = new Windows();
    private final Text text = new Text();
    private final Folds foldLines = new Folds();
    private final Running header = new Running();
    private final Running footer = Running.footerDefaults();

    public Page getPage() {
        return page;
    }

    public MarginSettings getMargins() {
        return margins;
    }

    public Windows getWindows() {
        return windows;
    }

    public Text getText() {
        return text;
    }

    public Folds getFoldLines() {
        return foldLines;
    }

    public Running getHeader() {
        return header;
    }

    public Running getFooter() {
        return footer;
    }

    /**
     * Converts the bound values into the immutable domain configuration.
     *
     * @return validated configuration
     * @throws com.example.letters.domain.exception.ConfigurationException when a value breaks an invariant
     */
    public LetterConfiguration toConfiguration() {
        Header headerDefaults = Header.defaults();
        Footer footerDefaults = Footer.defaults();
        Positioning positioning = new Positioning(
                new Margins(margins.getTop(), margins.getBottom(), margins.getLeft(), margins.getRight()),
                windows.getReturnAddress().toPosition(),
                windows.getRecipientAddress().toPosition(),
                new DatePosition(windows.getDateX(), windows.getDateY(), DateAlignment.fromString(windows.getDateAlignment())),
                windows.getBodyStartY()
        );
        Formatting formatting = new Formatting(
                FontFamily.fromName(text.getFontFamily()),
                text.getFontSize(),
                text.getLineSpacing(),
                text.getParagraphSpacing(),
                text.isIndentParagraphs(),
                text.getIndentSize(),
                text.getClosingReserve()
        );
        FoldLineStyle foldStyle = FoldLineStyle.defaults();
        FoldLines folds = new FoldLines(
                foldLines.isEnabled(),
                foldLines.getPositions(),
                new FoldLineStyle(foldStyle.lineLengthMm(), foldStyle.marginOffsetMm(),
                        RgbColor.fromHex(foldLines.getColor()), foldStyle.lineWidth(),
                        LineStyle.fromString(foldLines.getLineStyle()))
        );
        Header runningHeader = new Header(
                new HeaderContent(header.isFirstPageEnabled(), header.getFirstPageLeft(),
                        header.getFirstPageCenter(), header.getFirstPageRight()),
                new HeaderContent(header.isEnabled(), header.getLeft(), header.getCenter(), header.getRight()),
                headerDefaults.fontSize(),
                headerDefaults.color(),
                header.isRule()
        );
        Footer runningFooter = new Footer(footer.isEnabled(), footer.getLeft(), footer.getCenter(), footer.getRight(),
                footerDefaults.fontSize(), footerDefaults.color(), footer.isRule());
        return new LetterConfiguration(new PageSize(page.getWidth(), page.getHeight()), positioning, formatting,
                folds, runningHeader, runningFooter);
    }

    public static class Page {
        private double width = PageSize.US_LETTER.width();
        private double height = PageSize.US_LETTER.height();

        public double getWidth() {
            return width;
        }

        public void setWidth(double width) {
            this.width = width;
        }

        public double getHeight() {
            return height;
        }

        public void setHeight(double height) {
            this.height = height;
        }
    }

    public static class MarginSettings {
        private double top = Margins.defaults().top();
        private double bottom = Margins.defaults().bottom();
        private double left = Margins.defaults().left();
        private double right = Margins.defaults().right();

        public double getTop() {
            return top;
        }

        public void setTop(double top) {
            this.top = top;
        }

        public double getBottom() {
            return bottom;
        }

        public void setBottom(double bottom) {
            this.bottom = bottom;
        }

        public double getLeft() {
            return left;
        }

        public void setLeft(double left) {
            this.left = left;
        }

        public double getRight() {
            return right;
        }

        public void setRight(double right) {
            this.right = right;
        }
    }

    public static class Box {
        private double x;
        private double y;
        private double width;
        private Double height;

        Box() {
        }

        Box(AddressPosition defaults) {
            this.x = defaults.x();
            this.y = defaults.y();
            this.width = defaults.width();
            this.height = defaults.height();
        }

        AddressPosition toPosition() {
            return new AddressPosition(x, y, width, height);
        }

        public double getX() {
            return x;
        }

        public void setX(double x) {
            this.x = x;
        }

        public double getY() {
            return y;
        }

        public void setY(double y) {
            this.y = y;
        }

        public double getWidth() {
            return width;
        }

        public void setWidth(double width) {
            this.width = width;
        }

        public Double getHeight() {
            return height;
        }

        public void setHeight(Double height) {
            this.height = height;
        }
    }

    public static class Windows {
        private final Box returnAddress = new Box(AddressPosition.returnAddressDefaults());
        private final Box recipientAddress = new Box(AddressPosition.recipientAddressDefaults());
        private double dateX = DatePosition.defaults().x();
        private double dateY = DatePosition.defaults().y();
        private String dateAlignment = DatePosition.defaults().alignment().name();
        private double bodyStartY = Positioning.defaults().bodyStartY();

        public Box getReturnAddress() {
            return returnAddress;
        }

        public Box getRecipientAddress() {
            return recipientAddress;
        }

        public double getDateX() {
            return dateX;
        }

        public void setDateX(double dateX) {
            this.dateX = dateX;
        }

        public double getDateY() {
            return dateY;
        }

        public void setDateY(double dateY) {
            this.dateY = dateY;
        }

        public String getDateAlignment() {
            return dateAlignment;
        }

        public void setDateAlignment(String dateAlignment) {
            this.dateAlignment = dateAlignment;
        }

        public double getBodyStartY() {
            return bodyStartY;
        }

        public void setBodyStartY(double bodyStartY) {
            this.bodyStartY = bodyStartY;
        }
    }

    public static class Text {
        private String fontFamily = Formatting.defaults().fontFamily().familyName();
        private double fontSize = Formatting.defaults().fontSize();
        private double lineSpacing = Formatting.defaults().lineSpacing();
        private double paragraphSpacing = Formatting.defaults().paragraphSpacing();
        private boolean indentParagraphs = Formatting.defaults().indentParagraphs();
        private double indentSize = Formatting.defaults().indentSize();
        private double closingReserve = Formatting.defaults().closingReserve();

        public String getFontFamily() {
            return fontFamily;
        }

        public void setFontFamily(String fontFamily) {
            this.fontFamily = fontFamily;
        }

        public double getFontSize() {
            return fontSize;
        }

        public void setFontSize(double fontSize) {
            this.fontSize = fontSize;
        }

        public double getLineSpacing() {
            return lineSpacing;
        }

        public void setLineSpacing(double lineSpacing) {
            this.lineSpacing = lineSpacing;
        }

        public double getParagraphSpacing() {
            return paragraphSpacing;
        }

        public void setParagraphSpacing(double paragraphSpacing) {
            this.paragraphSpacing = paragraphSpacing;
        }

        public boolean isIndentParagraphs() {
            return indentParagraphs;
        }

        public void setIndentParagraphs(boolean indentParagraphs) {
            this.indentParagraphs = indentParagraphs;
        }

        public double getIndentSize() {
            return indentSize;
        }

        public void setIndentSize(double indentSize) {
            this.indentSize = indentSize;
        }

        public double getClosingReserve() {
            return closingReserve;
        }

        public void setClosingReserve(double closingReserve) {
            this.closingReserve = closingReserve;
        }
    }

    public static class Folds {
        private boolean enabled = FoldLines.defaults().enabled();
        private List<Double> positions = new ArrayList<>(FoldLines.defaults().positions());
        private String color = "#CCCCCC";
        private String lineStyle = LineStyle.SOLID.name();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<Double> getPositions() {
            return positions;
        }

        public void setPositions(List<Double> positions) {
            this.positions = positions;
        }

        public String getColor() {
            return color;
        }

        public void setColor(String color) {
            this.color = color;
        }

        public String getLineStyle() {
            return lineStyle;
        }

        public void setLineStyle(String lineStyle) {
            this.lineStyle = lineStyle;
        }
    }

    /**
     * Header or footer zones. The first-page fields only apply to the header.
     */
    public static class Running {
        private boolean enabled = true;
        private boolean firstPageEnabled;
        private String firstPageLeft = "";
        private String firstPageCenter = "";
        private String firstPageRight = "";
        private String left = "";
        private String center = "";
        private String right = "";
        private boolean rule = true;

        static Running footerDefaults() {
            Running footer = new Running();
            footer.setCenter(Footer.defaults().center());
            return footer;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isFirstPageEnabled() {
            return firstPageEnabled;
        }

        public void setFirstPageEnabled(boolean firstPageEnabled) {
            this.firstPageEnabled = firstPageEnabled;
        }

        public String getFirstPageLeft() {
            return firstPageLeft;
        }

        public void setFirstPageLeft(String firstPageLeft) {
            this.firstPageLeft = firstPageLeft;
        }

        public String getFirstPageCenter() {
            return firstPageCenter;
        }

        public void setFirstPageCenter(String firstPageCenter) {
            this.firstPageCenter = firstPageCenter;
        }

        public String getFirstPageRight() {
            return firstPageRight;
        }

        public void setFirstPageRight(String firstPageRight) {
            this.firstPageRight = firstPageRight;
        }

        public String getLeft() {
            return left;
        }

        public void setLeft(String left) {
            this.left = left;
        }

        public String getCenter() {
            return center;
        }

        public void setCenter(String center) {
            this.center = center;
        }

        public String getRight() {
            return right;
        }

        public void setRight(String right) {
            this.right = right;
        }

        public boolean isRule() {
            return rule;
        }

        public void setRule(boolean rule) {
            this.rule = rule;
        }
    }
}
