package com.mini_x.social_graph.service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import com.mini_x.social_graph.entity.Identified;
import com.mini_x.social_graph.exception.InvalidInputException;

/**
 * Turns the targets of a graph call into a flat, ordered list.
 *
 * A target is an identity (String or integral Number), an {@link Identified}
 * object, or a collection/array of those. One level of nesting is flattened,
 * anything deeper is rejected.
 */
public final class TargetNormalizer {

    private static final String EXPECTED = "an identity or an Identified object";

    private TargetNormalizer() {
    }


    public static List<Object> flatten(List<?> targets) {
        if (targets == null) {
            throw new InvalidInputException("Targets can not be Null");
        }
        List<Object> flat = new ArrayList<>();
        for (Object target : targets) {
            Collection<?> nested = asCollection(target);
            if (nested == null) {
                flat.add(requireTarget(target));
                continue;
            }
            for (Object inner : nested) {
                if (asCollection(inner) != null) {
                    throw new InvalidInputException(inner, EXPECTED + " (only one level of nesting is allowed)");
                }
                flat.add(requireTarget(inner));
            }
        }
        return flat;
    }

    public static List<String> identities(List<?> targets) {
        List<Object> flat = flatten(targets);
        List<String> ids = new ArrayList<>(flat.size());
        for (Object target : flat) {
            ids.add(identityOf(target));
        }
        return ids;
    }

    public static String identityOf(Object target) {
        Object value = target instanceof Identified ? ((Identified) target).getId() : target;
        if (value instanceof String) {
            String id = (String) value;
            if (id.isBlank()) {
                throw new InvalidInputException("ID can not be empty");
            }
            return id;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return value.toString();
        }
        throw new InvalidInputException(value, EXPECTED);
    }

    private static Object requireTarget(Object target) {
        identityOf(target);
        return target;
    }

    private static Collection<?> asCollection(Object target) {
        if (target instanceof Collection) {
            return (Collection<?>) target;
        }
        if (target instanceof Object[]) {
            return Arrays.asList((Object[]) target);
        }
        return null;
    }
}
