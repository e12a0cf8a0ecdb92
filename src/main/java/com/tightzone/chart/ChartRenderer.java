package com.tightzone.chart;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.Stroke;
import java.awt.geom.Path2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * 模块说明：ChartRenderer（class）。
 * 主要职责：用 Java2D 绘制价格线、收缩区间色带与成交量柱，输出 PNG。
 * 使用建议：运行在无显示环境时需设置 java.awt.headless=true。
 */
public class ChartRenderer {
    static final Color PRICE_COLOR = new Color(0x25, 0x63, 0xeb);
    static final Color VOLUME_COLOR = new Color(0x6b, 0x72, 0x80);
    static final Color LATEST_ZONE_COLOR = new Color(0xf5, 0x9e, 0x0b);
    static final Color EARLIER_ZONE_COLOR = new Color(0xfb, 0xbf, 0x24);
    static final int ZONE_FILL_ALPHA = Math.round(0.15f * 255);

    private static final DateTimeFormatter AXIS_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private final int width;
    private final int height;
    private final ContractionZoneDetector detector;

    public ChartRenderer() {
        this(1200, 720);
    }

    public ChartRenderer(int width, int height) {
        this.width = Math.max(320, width);
        this.height = Math.max(240, height);
        this.detector = new ContractionZoneDetector();
    }

    public void render(String symbol, List<PriceBar> series, Path out) throws IOException {
        render(symbol, series, null, out);
    }

/**
 * 方法说明：render，负责绘制单个代码的图表。
 * 处理流程：zones 为 null 时用默认分段数现场识别；最后一个区间用深色，其余用浅色。
 */
    public void render(String symbol, List<PriceBar> series, List<ContractionZone> zones, Path out) throws IOException {
        if (series == null || series.isEmpty()) {
            throw new IllegalArgumentException("series must contain at least one data point");
        }
        List<ContractionZone> marked = zones == null ? detector.detect(series) : zones;

        int left = 90;
        int right = 40;
        int top = 70;
        int bottom = 60;
        int gap = 16;
        int pw = width - left - right;
        int total = height - top - bottom - gap;
        int priceH = total * 3 / 4;
        int volTop = top + priceH + gap;
        int volH = total - priceH;

        double yMin = Double.POSITIVE_INFINITY;
        double yMax = Double.NEGATIVE_INFINITY;
        double vMax = 0.0;
        for (PriceBar bar : series) {
            yMin = Math.min(yMin, bar.close);
            yMax = Math.max(yMax, bar.close);
            vMax = Math.max(vMax, bar.volume);
        }
        double pad = (yMax - yMin) * 0.05;
        if (pad <= 0) {
            pad = Math.max(Math.abs(yMax) * 0.01, 1.0);
        }
        yMin -= pad;
        yMax += pad;

        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);

            g.setColor(Color.BLACK);
            g.setFont(new Font("SansSerif", Font.BOLD, 24));
            g.drawString(symbol + " · VCP focus", left, 42);

            drawGrid(g, series, left, top, pw, priceH, yMin, yMax, volTop, volH);
            drawZones(g, series.size(), marked, left, top, pw, priceH, yMin, yMax);
            drawPrice(g, series, left, top, pw, priceH, yMin, yMax);
            drawVolume(g, series, left, volTop, pw, volH, vMax);

            g.setColor(new Color(120, 126, 138));
            g.drawRect(left, top, pw, priceH);
            g.drawRect(left, volTop, pw, volH);
        } finally {
            g.dispose();
        }

        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (!ImageIO.write(img, "png", out.toFile())) {
            throw new IOException("no PNG writer available for " + out);
        }
    }

    private static void drawGrid(Graphics2D g, List<PriceBar> series, int left, int top, int pw, int ph,
                                 double yMin, double yMax, int volTop, int volH) {
        g.setFont(new Font("SansSerif", Font.PLAIN, 14));
        for (int i = 0; i <= 5; i++) {
            int y = top + (int) Math.round((double) i / 5 * ph);
            g.setColor(new Color(232, 235, 240));
            g.drawLine(left, y, left + pw, y);
            double v = yMax - (yMax - yMin) * i / 5.0;
            g.setColor(new Color(86, 95, 111));
            g.drawString(String.format(Locale.US, "%.2f", v), 12, y + 5);
        }
        int ticks = Math.min(6, series.size() - 1);
        for (int i = 0; i <= ticks && ticks > 0; i++) {
            int idx = (int) Math.round((series.size() - 1) * (i / (double) ticks));
            int x = toX(idx, series.size(), left, pw);
            g.setColor(new Color(240, 242, 246));
            g.drawLine(x, top, x, volTop + volH);
            g.setColor(new Color(86, 95, 111));
            if (series.get(idx).timestamp != null) {
                g.drawString(AXIS_DATE.format(series.get(idx).timestamp), x - 36, volTop + volH + 22);
            }
        }
        g.drawString("Close ($)", 12, top - 10);
        g.drawString("Volume", 12, volTop + 14);
    }

    private static void drawZones(Graphics2D g, int size, List<ContractionZone> zones, int left, int top, int pw, int ph,
                                  double yMin, double yMax) {
        Stroke old = g.getStroke();
        g.setStroke(new BasicStroke(1f));
        for (int i = 0; i < zones.size(); i++) {
            ContractionZone zone = zones.get(i);
            Color base = i == zones.size() - 1 ? LATEST_ZONE_COLOR : EARLIER_ZONE_COLOR;
            int x0 = toX(zone.startIndex, size, left, pw);
            int x1 = toX(zone.endIndex, size, left, pw);
            int yHigh = toY(zone.high, yMin, yMax, top, ph);
            int yLow = toY(zone.low, yMin, yMax, top, ph);
            g.setColor(new Color(base.getRed(), base.getGreen(), base.getBlue(), ZONE_FILL_ALPHA));
            g.fillRect(x0, yHigh, Math.max(1, x1 - x0), Math.max(1, yLow - yHigh));
            g.setColor(base);
            g.drawLine(x0, yHigh, x1, yHigh);
            g.drawLine(x0, yLow, x1, yLow);
        }
        g.setStroke(old);
    }

    private static void drawPrice(Graphics2D g, List<PriceBar> series, int left, int top, int pw, int ph,
                                  double yMin, double yMax) {
        Path2D path = new Path2D.Double();
        for (int i = 0; i < series.size(); i++) {
            int x = toX(i, series.size(), left, pw);
            int y = toY(series.get(i).close, yMin, yMax, top, ph);
            if (i == 0) {
                path.moveTo(x, y);
            } else {
                path.lineTo(x, y);
            }
        }
        Stroke old = g.getStroke();
        g.setColor(PRICE_COLOR);
        g.setStroke(new BasicStroke(2f, BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND));
        if (series.size() == 1) {
            int x = toX(0, 1, left, pw);
            int y = toY(series.get(0).close, yMin, yMax, top, ph);
            g.fillOval(x - 3, y - 3, 6, 6);
        } else {
            g.draw(path);
        }
        g.setStroke(old);
    }

    private static void drawVolume(Graphics2D g, List<PriceBar> series, int left, int volTop, int pw, int volH, double vMax) {
        if (vMax <= 0) {
            return;
        }
        int barW = Math.max(1, (int) Math.floor(pw / (double) series.size() * 0.8));
        g.setColor(VOLUME_COLOR);
        for (int i = 0; i < series.size(); i++) {
            double v = Math.max(0.0, series.get(i).volume);
            int h = (int) Math.round(v / vMax * volH);
            int x = toX(i, series.size(), left, pw) - barW / 2;
            g.fillRect(x, volTop + volH - h, barW, h);
        }
    }

    private static int toX(int index, int size, int left, int width) {
        if (size <= 1) return left + width / 2;
        return left + (int) Math.round(index * 1.0 / (size - 1) * width);
    }

    private static int toY(double value, double min, double max, int top, int height) {
        if (max <= min) return top + height / 2;
        double ratio = (value - min) / (max - min);
        return top + height - (int) Math.round(ratio * height);
    }
}
