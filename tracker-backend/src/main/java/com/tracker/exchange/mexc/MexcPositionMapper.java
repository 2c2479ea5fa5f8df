package com.tracker.exchange.mexc;

import com.tracker.core.model.Position;
import com.tracker.core.model.PositionSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Normalizes raw MEXC records into {@link Position}. Records that cannot be normalized are
 * skipped with a warning rather than failing the whole poll.
 */
final class MexcPositionMapper {
    private static final Logger logger = LoggerFactory.getLogger(MexcPositionMapper.class);

    private MexcPositionMapper() {
    }

    static Optional<Position> toPosition(MexcPosition raw) {
        if (raw == null || raw.symbol() == null || raw.symbol().isBlank()) {
            logger.warn("Skipping MEXC position without symbol: {}", raw);
            return Optional.empty();
        }

        double size = raw.holdVol() == null ? 0 : raw.holdVol();
        if (size == 0) {
            return Optional.empty();
        }

        PositionSide side = sideOf(raw.positionType());
        if (side == null) {
            logger.warn("Skipping {}: unknown positionType {}", raw.symbol(), raw.positionType());
            return Optional.empty();
        }

        double entry = raw.holdAvgPrice() == null ? 0 : raw.holdAvgPrice();
        if (entry < 0 || !Double.isFinite(entry)) {
            logger.warn("Skipping {}: invalid holdAvgPrice {}", raw.symbol(), raw.holdAvgPrice());
            return Optional.empty();
        }

        double leverage = raw.leverage() == null || raw.leverage() < 1 ? 1 : raw.leverage();

        // open_positions carries no mark price
        return Optional.of(new Position(raw.symbol(), side, entry, 0, size, leverage));
    }

    private static PositionSide sideOf(Integer positionType) {
        if (positionType == null) {
            return null;
        }
        return switch (positionType) {
            case 1 -> PositionSide.LONG;
            case 2 -> PositionSide.SHORT;
            default -> null;
        };
    }
}
