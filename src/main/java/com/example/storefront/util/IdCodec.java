package com.example.storefront.util;

import com.example.storefront.exception.InvalidIdentifierException;
import org.bson.types.ObjectId;

/**
 * Converts between store-native identifiers and the opaque strings used on the wire.
 */
public final class IdCodec {

    private IdCodec() {
    }

    public static String encode(ObjectId id) {
        return id == null ? null : id.toHexString();
    }

    public static ObjectId decode(String input) {
        if (input == null || !ObjectId.isValid(input)) {
            throw new InvalidIdentifierException();
        }
        return new ObjectId(input);
    }
}
