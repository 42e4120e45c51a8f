package com.example.privacyguard.service.detection;

import com.example.privacyguard.config.PrivacyGuardProperties.PlateFilters;
import com.example.privacyguard.model.BoundingBox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Geometric post-filters for license plate candidates. A candidate survives only if it passes
 * every enabled stage. The shrink stage runs last since it changes the geometry the other stages
 * measure.
 */
public class PlateFilterPipeline {

    private static final Logger log = LoggerFactory.getLogger(PlateFilterPipeline.class);

    enum Stage {
        CONFIDENCE_FLOOR,
        ASPECT_RATIO,
        VERTICAL_POSITION,
        SIZE,
        SHRINK;

        String label() {
            return name().toLowerCase(Locale.ROOT).replace('_', '-');
        }
    }

    private final PlateFilters filters;

    public PlateFilterPipeline(PlateFilters filters) {
        this.filters = Objects.requireNonNull(filters, "filters");
    }

    public Optional<BoundingBox> apply(BoundingBox box, int imageWidth, int imageHeight) {
        if (filters.isConfidenceFloorEnabled() && box.confidence() < filters.getConfidenceFloor()) {
            return reject(Stage.CONFIDENCE_FLOOR, box, box.confidence(), filters.getConfidenceFloor());
        }
        if (filters.isAspectEnabled() && outsideAspectBand(box)) {
            return Optional.empty();
        }
        if (filters.isVerticalPositionEnabled()) {
            double centerYFraction = (box.y() + box.height() / 2.0) / imageHeight;
            if (centerYFraction < filters.getMinCenterYFraction()) {
                return reject(Stage.VERTICAL_POSITION, box, centerYFraction, filters.getMinCenterYFraction());
            }
        }
        if (filters.isSizeEnabled()) {
            double widthFraction = box.width() / (double) imageWidth;
            if (widthFraction > filters.getMaxWidthFraction()) {
                return reject(Stage.SIZE, box, widthFraction, filters.getMaxWidthFraction());
            }
            double heightFraction = box.height() / (double) imageHeight;
            if (heightFraction > filters.getMaxHeightFraction()) {
                return reject(Stage.SIZE, box, heightFraction, filters.getMaxHeightFraction());
            }
        }
        BoundingBox surviving = box;
        if (filters.isShrinkEnabled()) {
            Optional<BoundingBox> shrunk = BoxGeometry.shrink(box, filters.getShrinkFraction());
            if (shrunk.isEmpty()) {
                return reject(Stage.SHRINK, box, Math.min(box.width(), box.height()), filters.getShrinkFraction());
            }
            surviving = shrunk.get();
            // Per-axis flooring can push the ratio out of the band.
            if (filters.isAspectEnabled() && outsideAspectBand(surviving)) {
                return Optional.empty();
            }
        }
        return BoxGeometry.clamp(surviving, imageWidth, imageHeight);
    }

    private boolean outsideAspectBand(BoundingBox box) {
        double aspect = box.width() / (double) box.height();
        if (aspect < filters.getMinAspect()) {
            reject(Stage.ASPECT_RATIO, box, aspect, filters.getMinAspect());
            return true;
        }
        if (aspect > filters.getMaxAspect()) {
            reject(Stage.ASPECT_RATIO, box, aspect, filters.getMaxAspect());
            return true;
        }
        return false;
    }

    private Optional<BoundingBox> reject(Stage stage, BoundingBox box, double value, double threshold) {
        if (filters.isDebugRejections()) {
            log.info("Plate candidate {} rejected by {} filter: value={} threshold={}",
                    describe(box), stage.label(), format(value), format(threshold));
        } else if (log.isDebugEnabled()) {
            log.debug("Plate candidate {} rejected by {} filter: value={} threshold={}",
                    describe(box), stage.label(), format(value), format(threshold));
        }
        return Optional.empty();
    }

    private static String describe(BoundingBox box) {
        return String.format(Locale.ROOT, "(%d,%d %dx%d conf=%.3f)", box.x(), box.y(), box.width(), box.height(),
                box.confidence());
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
