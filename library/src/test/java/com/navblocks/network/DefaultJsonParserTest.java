package com.navblocks.network;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.navblocks.model.Customer;
import com.navblocks.model.ODataIgnore;
import com.navblocks.model.SoapIgnore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DefaultJsonParser")
class DefaultJsonParserTest {

    @Nested
    @DisplayName("OData configuration")
    class ODataTests {
        private final JsonParser parser = new DefaultJsonParser(ODataIgnore.class);

        @Test
        @DisplayName("reads NAV field names, ETag and dates")
        void readsCustomer() {
            String json = "{\"@odata.etag\":\"W/\\\"abc\\\"\",\"No\":\"10000\",\"Name\":\"Adatum\"," +
                    "\"Balance_LCY\":125.5,\"Blocked\":true,\"Last_Date_Modified\":\"2024-03-01\",\"Unknown\":1}";

            Customer customer = parser.fromJson(json, Customer.class);

            assertThat(customer.getEtag()).isEqualTo("W/\"abc\"");
            assertThat(customer.getNo()).isEqualTo("10000");
            assertThat(customer.getBalance()).isEqualByComparingTo(new BigDecimal("125.5"));
            assertThat(customer.isBlocked()).isTrue();
            assertThat(customer.getLastDateModified()).isEqualTo(LocalDate.of(2024, 3, 1));
        }

        @Test
        @DisplayName("never writes the SOAP key or null fields")
        void leavesOutKeyAndNulls() {
            Customer customer = new Customer("10000", null);
            customer.setKey("32;GwAAAAJ7/zEAMAAwADAAMA==");

            JsonObject json = parser.toJsonTree(customer).getAsJsonObject();

            assertThat(json.has("No")).isTrue();
            assertThat(json.has("Name")).isFalse();
            assertThat(json.has("Key")).isFalse();
        }

        @Test
        @DisplayName("wraps malformed JSON in IllegalArgumentException")
        void rejectsMalformedJson() {
            assertThatThrownBy(() -> parser.fromJson("{\"No\":", Customer.class))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Couldn't parse JSON");
        }
    }

    @Nested
    @DisplayName("SOAP configuration")
    class SoapTests {
        private final JsonParser parser = new DefaultJsonParser(SoapIgnore.class);

        @Test
        @DisplayName("writes the key but never the ETag")
        void leavesOutEtag() {
            Customer customer = new Customer("10000", "Adatum");
            customer.setKey("K1");
            customer.setEtag("W/\"abc\"");

            JsonObject json = parser.toJsonTree(customer).getAsJsonObject();

            assertThat(json.get("Key").getAsString()).isEqualTo("K1");
            assertThat(json.has("@odata.etag")).isFalse();
        }
    }

    @Test
    @DisplayName("custom adapters take part in both directions")
    void customAdapter() {
        DefaultJsonParser parser = new DefaultJsonParser();
        parser.registerAdapter(BigDecimal.class, new JsonAdapter<BigDecimal>() {
            @Override
            public BigDecimal deserialize(JsonElement jsonElement) {
                return new BigDecimal(jsonElement.getAsString().replace(',', '.'));
            }

            @Override
            public JsonElement serialize(BigDecimal value) {
                return new com.google.gson.JsonPrimitive(value.toPlainString().replace('.', ','));
            }
        });

        Customer customer = parser.fromJson("{\"Balance_LCY\":\"1,25\"}", Customer.class);
        assertThat(customer.getBalance()).isEqualByComparingTo("1.25");
        assertThat(parser.toJson(customer)).contains("\"Balance_LCY\":\"1,25\"");
    }

    @Test
    @DisplayName("unparsable dates read as null")
    void lenientDates() {
        assertThat(LocalDateAdapter.parse("not a date")).isNull();
        assertThat(LocalDateAdapter.parse(" ")).isNull();
        assertThat(LocalDateAdapter.parse("0001-01-01")).isEqualTo(LocalDate.of(1, 1, 1));
        assertThat(LocalDateAdapter.format(LocalDate.of(2024, 12, 31))).isEqualTo("2024-12-31");
    }

}
