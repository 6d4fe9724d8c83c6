package io.poolscope.store;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.poolscope.error.ValidationException;
import io.poolscope.util.Jsons;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class FieldPathTest {
    @Test
    void fieldNamesAreLowerCasedUnderValueContainer() {
        assertEquals("value.maxcontainers", FieldPath.of(" MaxContainers "));
        assertEquals("value.limits.cpu", FieldPath.of("Limits.CPU"));
        assertThrows(ValidationException.class, () -> FieldPath.of(" "));
    }

    @Test
    void parseRejectsMalformedPaths() {
        assertEquals(List.of("a", "b"), FieldPath.parse("value.a.b").segments());
        assertThrows(ValidationException.class, () -> FieldPath.parse("value"));
        assertThrows(ValidationException.class, () -> FieldPath.parse("val.a"));
        assertThrows(ValidationException.class, () -> FieldPath.parse("value..a"));
    }

    @Test
    void vacancyCoversMissingAndEmptyStringOnly() throws Exception {
        ObjectNode root = (ObjectNode) Jsons.storageMapper().readTree("{\"a\":\"\",\"b\":null,\"c\":\"x\",\"d\":0}");
        assertTrue(FieldPath.parse("value.a").isVacant(root));
        assertFalse(FieldPath.parse("value.b").isVacant(root));
        assertTrue(FieldPath.parse("value.missing").isVacant(root));
        assertFalse(FieldPath.parse("value.c").isVacant(root));
        assertFalse(FieldPath.parse("value.d").isVacant(root));
    }

    @Test
    void writeRefusesToDescendIntoScalar() throws Exception {
        ObjectNode root = (ObjectNode) Jsons.storageMapper().readTree("{\"image\":\"x\"}");
        assertThrows(ValidationException.class, () -> FieldPath.parse("value.image.tag").write(root, TextNode.valueOf("y")));
    }
}
