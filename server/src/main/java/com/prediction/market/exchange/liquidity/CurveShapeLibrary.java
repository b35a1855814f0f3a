package com.prediction.market.exchange.liquidity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.prediction.market.exchange.entity.CurvePoint;
import com.prediction.market.exchange.entity.CurveShape;
import com.prediction.market.exchange.entity.ShapeType;
import com.prediction.market.exchange.error.InvalidArgumentException;
import com.prediction.market.exchange.error.InvalidStateException;
import com.prediction.market.exchange.error.NotFoundException;
import com.prediction.market.exchange.ledger.LedgerClock;
import com.prediction.market.exchange.ledger.LedgerSession;

import lombok.extern.slf4j.Slf4j;

/**
 * Named curve shapes. Exactly one shape is the default; it is created as a
 * bell curve the first time anyone asks for it.
 */
@Slf4j
public class CurveShapeLibrary {

    static final String DEFAULT_NAME = "Default Bell";

    private final LedgerClock clock;

    public CurveShapeLibrary(LedgerClock clock) {
        this.clock = clock;
    }

    public CurveShape save(LedgerSession session, String name, ShapeType type, Map<String, Double> params,
            List<CurvePoint> customPoints) {
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("shape name is required");
        }
        if (type == null) {
            throw new InvalidArgumentException("shape type is required");
        }
        ShapeParams typed = ShapeParams.of(type, params, customPoints);
        long now = clock.tick();
        CurveShape shape = CurveShape.builder()
            .id(UUID.randomUUID().toString())
            .name(name.trim())
            .type(type)
            .params(typed.toMap())
            .points(ShapeGenerator.generate(typed))
            .createdAt(now)
            .updatedAt(now)
            .build();
        session.saveCurveShape(shape);
        log.info("Curve shape saved: id={}, name={}, type={}", shape.getId(), shape.getName(), type);
        return shape;
    }

    public List<CurveShape> list(LedgerSession session) {
        getDefault(session);
        return session.findAllCurveShapes();
    }

    public CurveShape get(LedgerSession session, String shapeId) {
        return session.findCurveShape(shapeId)
            .orElseThrow(() -> new NotFoundException("Curve shape", shapeId));
    }

    public CurveShape getDefault(LedgerSession session) {
        return session.findDefaultCurveShape().orElseGet(() -> {
            CurveShape shape = builtInDefault();
            session.saveCurveShape(shape);
            log.info("Default curve shape created: shapeId={}", shape.getId());
            return shape;
        });
    }

    /**
     * Points of the default shape, without creating it when none is stored.
     */
    public List<CurvePoint> defaultPoints(LedgerSession session) {
        return session.findDefaultCurveShape().orElseGet(this::builtInDefault).getPoints();
    }

    private CurveShape builtInDefault() {
        ShapeParams bell = ShapeParams.of(ShapeType.BELL, Map.of(), null);
        long now = clock.tick();
        return CurveShape.builder()
            .id(UUID.randomUUID().toString())
            .name(DEFAULT_NAME)
            .type(ShapeType.BELL)
            .params(bell.toMap())
            .points(ShapeGenerator.generate(bell))
            .defaultShape(true)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    public CurveShape setDefault(LedgerSession session, String shapeId) {
        CurveShape chosen = get(session, shapeId);
        long now = clock.tick();
        for (CurveShape shape : session.findAllCurveShapes()) {
            if (shape.isDefaultShape() && !shape.getId().equals(shapeId)) {
                shape.setDefaultShape(false);
                shape.setUpdatedAt(now);
                session.saveCurveShape(shape);
            }
        }
        chosen.setDefaultShape(true);
        chosen.setUpdatedAt(now);
        session.saveCurveShape(chosen);
        log.info("Default curve shape set: id={}, name={}", chosen.getId(), chosen.getName());
        return chosen;
    }

    /**
     * Merge {@code params} over the stored ones and regenerate the points.
     * A custom shape takes new points if given and keeps its own otherwise.
     */
    public CurveShape update(LedgerSession session, String shapeId, Map<String, Double> params,
            List<CurvePoint> customPoints) {
        CurveShape shape = get(session, shapeId);
        Map<String, Double> merged = new LinkedHashMap<>(shape.getParams());
        if (params != null) {
            merged.putAll(params);
        }
        List<CurvePoint> points = customPoints != null ? customPoints : shape.getPoints();
        ShapeParams typed = ShapeParams.of(shape.getType(), merged, points);

        shape.setParams(typed.toMap());
        shape.setPoints(ShapeGenerator.generate(typed));
        shape.setUpdatedAt(clock.tick());
        session.saveCurveShape(shape);
        return shape;
    }

    public void delete(LedgerSession session, String shapeId) {
        CurveShape shape = get(session, shapeId);
        if (shape.isDefaultShape()) {
            throw new InvalidStateException("Cannot delete the default shape");
        }
        session.deleteCurveShape(shapeId);
        log.info("Curve shape deleted: id={}, name={}", shapeId, shape.getName());
    }
}
