package io.possync.remote;

import com.fasterxml.jackson.databind.JsonNode;
import io.possync.model.CatalogItem;
import io.possync.model.Identity;
import io.possync.model.Role;
import io.possync.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;

final class WireCodecTest {

    @Test
    void catalogItemAcceptsLegacyFieldNames() throws Exception {
        JsonNode node = Jsons.mapper().readTree("""
                {"id":12,"name":"Latte","default_price":"4.25","stock_quantity":8,"min_stock_level":10,
                 "store_id":"store-001","is_active":1}
                """);
        CatalogItem item = WireCodec.catalogItem(node);
        Assertions.assertEquals("12", item.id());
        Assertions.assertEquals(4.25, item.price(), 1e-9);
        Assertions.assertEquals(10, item.minStock());
        Assertions.assertTrue(item.active());
        Assertions.assertTrue(item.isLowStock());
    }

    @Test
    void identityKeepsMirroredCredentialAndParsesSqlTimestamps() throws Exception {
        JsonNode node = Jsons.mapper().readTree("""
                {"id":"user-002","email":" Manager@TechCorp.com","password":"password123","role":"Manager",
                 "company_id":"company-001","last_login":"2026-10-18 21:15:00"}
                """);
        Identity identity = WireCodec.identity(node);
        Assertions.assertEquals("manager@techcorp.com", identity.email());
        Assertions.assertEquals("password123", identity.passwordHash());
        Assertions.assertEquals(Role.MANAGER, identity.role());
        Assertions.assertTrue(identity.active());
        Assertions.assertEquals(Instant.parse("2026-10-18T21:15:00Z"), identity.lastLoginAt());
    }

    @Test
    void payloadFlattensEmbeddedAndTopLevelLines() throws Exception {
        JsonNode root = Jsons.mapper().readTree("""
                {"users":[{"id":"u1","email":"a@b.co","role":"cashier"}],
                 "sales":[{"id":"s-1","receipt_number":"R-1","store_id":"store-001","cashier_id":"u1","subtotal":5,
                           "items":[{"id":"li-1","product_id":"prod-001","quantity":1,"unit_price":5,"total_price":5}]},
                          {"id":"s-2","store_id":"store-001","cashier_id":"u1","subtotal":3}],
                 "sale_items":[{"sale_id":"s-2","product_id":"prod-003","quantity":1,"unit_price":3}]}
                """);
        SyncPayload payload = WireCodec.payload(root);
        Assertions.assertEquals(1, payload.identities().size());
        Assertions.assertEquals(2, payload.transactions().size());
        Assertions.assertEquals("R-s-2", payload.transactions().get(1).receiptNumber());
        Assertions.assertEquals("cash", payload.transactions().get(1).paymentMethod());
        Assertions.assertEquals(2, payload.transactionLines().size());
        Assertions.assertEquals("li-1", payload.transactionLines().get(0).id());
        Assertions.assertEquals("s-2:0", payload.transactionLines().get(1).id());
        Assertions.assertTrue(payload.stores().isEmpty());
    }

    @Test
    void malformedRowsAreRejected() throws Exception {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> WireCodec.payload(Jsons.mapper().readTree("[]")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> WireCodec.payload(Jsons.mapper().readTree("{\"sale_items\":[{\"product_id\":\"p\"}]}")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> WireCodec.identity(Jsons.mapper().readTree("{\"id\":\"u\",\"email\":\"a@b.co\",\"role\":\"owner\"}")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> WireCodec.catalogItem(Jsons.mapper().readTree("{\"id\":\"p\",\"name\":\"x\",\"price\":\"abc\"}")));
    }

    @Test
    void errorMessageLooksInsideNestedErrors() throws Exception {
        Assertions.assertEquals("nope", WireCodec.errorMessage(Jsons.mapper().readTree("{\"message\":\"nope\"}")));
        Assertions.assertEquals("deep", WireCodec.errorMessage(
                Jsons.mapper().readTree("{\"error\":{\"message\":\"deep\"}}")));
        Assertions.assertNull(WireCodec.errorMessage(Jsons.mapper().readTree("{}")));
    }
}
