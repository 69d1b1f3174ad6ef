package com.navblocks.soap;

import com.navblocks.exception.NavProtocolException;
import com.navblocks.model.Customer;
import com.navblocks.model.SoapResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static com.navblocks.soap.SoapFixtures.CUSTOMER_NS;
import static com.navblocks.soap.SoapFixtures.codeunit;
import static com.navblocks.soap.SoapFixtures.customer;
import static com.navblocks.soap.SoapFixtures.envelope;
import static com.navblocks.soap.SoapFixtures.readMultiple;
import static com.navblocks.soap.SoapFixtures.result;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SoapResponseParser")
class SoapResponseParserTest {

    private final SoapResponseParser parser = new SoapResponseParser();

    @Nested
    @DisplayName("ReadMultiple")
    class ReadMultiple {

        @Test
        @DisplayName("returns the entities in document order")
        void entities() {
            String response = readMultiple(
                    customer("K1", "10000", "Adatum"),
                    customer("K2", "20000", "Trey Research"));

            List<Customer> customers = parser.parseReadMultiple(response, Customer.class, "Customer");

            assertThat(customers).extracting(Customer::getNo).containsExactly("10000", "20000");
            assertThat(customers).extracting(Customer::getKey).containsExactly("K1", "K2");
        }

        @Test
        @DisplayName("an empty inner wrapper yields no entities")
        void emptyInner() {
            assertThat(parser.parseReadMultiple(readMultiple(), Customer.class, "Customer")).isEmpty();
        }

        @Test
        @DisplayName("a missing inner wrapper yields no entities")
        void missingInner() {
            String response = result("ReadMultiple_Result", "");

            assertThat(parser.parseReadMultiple(response, Customer.class, "Customer")).isEmpty();
        }

        @Test
        @DisplayName("a missing outer wrapper yields no entities")
        void missingOuter() {
            assertThat(parser.parseReadMultiple(envelope(""), Customer.class, "Customer")).isEmpty();
        }

        @Test
        @DisplayName("entities of another page namespace are not read")
        void otherNamespace() {
            String response = readMultiple(customer("K1", "10000", "Adatum"));

            assertThat(parser.parseReadMultiple(response, Customer.class, "Vendor")).isEmpty();
        }

        @Test
        @DisplayName("malformed XML is a protocol error")
        void malformed() {
            assertThatThrownBy(() -> parser.parseReadMultiple("<Soap:Envelope>", Customer.class, "Customer"))
                    .isInstanceOf(NavProtocolException.class)
                    .hasMessageStartingWith("Malformed SOAP response");
        }

    }

    @Nested
    @DisplayName("Read")
    class Read {

        @Test
        @DisplayName("returns the entity when present")
        void present() {
            String response = result("Read_Result", customer("K1", "10000", "Adatum"));

            Optional<Customer> customer = parser.parseRead(response, Customer.class, "Customer");

            assertThat(customer).hasValueSatisfying(value -> assertThat(value.getName()).isEqualTo("Adatum"));
        }

        @Test
        @DisplayName("returns empty when no entity was found")
        void absent() {
            assertThat(parser.parseRead(result("Read_Result", ""), Customer.class, "Customer")).isEmpty();
        }

        @Test
        @DisplayName("nested lists with one entry and pretty-printed empty elements bind")
        void nestedShapes() {
            String oneLine = envelope("<Read_Result xmlns=\"urn:microsoft-dynamics-schemas/page/salesorder\">" +
                    "<SalesOrder><No>S1</No><SalesLines><Sales_Order_Line><No>A</No></Sales_Order_Line>" +
                    "</SalesLines></SalesOrder></Read_Result>");
            String noLines = envelope("<Read_Result xmlns=\"urn:microsoft-dynamics-schemas/page/salesorder\">" +
                    "<SalesOrder><No>S2</No><SalesLines>\n    </SalesLines></SalesOrder></Read_Result>");

            assertThat(parser.parseRead(oneLine, XmlEntityBinderTest.SalesOrder.class, "SalesOrder"))
                    .hasValueSatisfying(order -> assertThat(order.lines.items)
                            .extracting(line -> line.no).containsExactly("A"));
            assertThat(parser.parseRead(noLines, XmlEntityBinderTest.SalesOrder.class, "SalesOrder"))
                    .hasValueSatisfying(order -> assertThat(order.lines).isNull());
        }

        @Test
        @DisplayName("unbindable entities are a protocol error")
        void unbindable() {
            String response = result("Read_Result",
                    "<Customer><Balance_LCY>plenty</Balance_LCY></Customer>");

            assertThatThrownBy(() -> parser.parseRead(response, Customer.class, "Customer"))
                    .isInstanceOf(NavProtocolException.class);
        }

    }

    @Nested
    @DisplayName("Create and Update")
    class CreateOrUpdate {

        @Test
        @DisplayName("reads Create_Result")
        void created() {
            String response = result("Create_Result", customer("K9", "30000", "New"));

            assertThat(parser.parseCreateOrUpdate(response, Customer.class, "Customer"))
                    .hasValueSatisfying(value -> assertThat(value.getKey()).isEqualTo("K9"));
        }

        @Test
        @DisplayName("falls back to Update_Result")
        void updated() {
            String response = result("Update_Result", customer("K9", "30000", "Renamed"));

            assertThat(parser.parseCreateOrUpdate(response, Customer.class, "Customer"))
                    .hasValueSatisfying(value -> assertThat(value.getName()).isEqualTo("Renamed"));
        }

        @Test
        @DisplayName("neither wrapper yields empty")
        void neither() {
            assertThat(parser.parseCreateOrUpdate(envelope(""), Customer.class, "Customer")).isEmpty();
        }

        @Test
        @DisplayName("an echoed create payload reads back as the original record")
        void echoedPayload() {
            Customer original = new Customer("40000", "Fabrikam");
            original.setCountryRegionCode("US");
            original.setBalance(new BigDecimal("1500.25"));
            original.setBlocked(true);
            original.setLastDateModified(LocalDate.of(2024, 5, 17));

            Element create = SoapPayloads.entity(CUSTOMER_NS, "Create", "Customer", original, new XmlEntityBinder());
            Element entity = Xml.firstChild(create, CUSTOMER_NS, "Customer");
            String response = envelope("<Create_Result xmlns=\"" + CUSTOMER_NS + "\">" +
                    Xml.toString(entity) + "</Create_Result>");

            Optional<Customer> echoed = parser.parseCreateOrUpdate(response, Customer.class, "Customer");

            assertThat(echoed).hasValueSatisfying(value -> assertThat(value)
                    .usingRecursiveComparison()
                    .ignoringFields("key", "etag")
                    .isEqualTo(original));
        }

    }

    @Nested
    @DisplayName("Delete")
    class Delete {

        @Test
        @DisplayName("succeeds when the result element is mentioned")
        void mentioned() {
            assertThat(SoapResponseParser.parseDelete(result("Delete_Result", "<Delete_Result>true</Delete_Result>")))
                    .isTrue();
            assertThat(SoapResponseParser.parseDelete("not even xml, but Delete_Result")).isTrue();
        }

        @Test
        @DisplayName("fails otherwise")
        void notMentioned() {
            assertThat(SoapResponseParser.parseDelete(envelope(""))).isFalse();
            assertThat(SoapResponseParser.parseDelete(null)).isFalse();
        }

    }

    @Nested
    @DisplayName("Codeunit")
    class Codeunit {

        @Test
        @DisplayName("returns the text of return_value")
        void returnValue() {
            String response = codeunit("SalesTools", "GetCreditLimit",
                    "<return_value>1500.00</return_value>");

            SoapResult result = SoapResponseParser.parseCodeunit(response, "GetCreditLimit", "SalesTools");

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getReturnValueAsString()).isEqualTo("1500.00");
        }

        @Test
        @DisplayName("a missing return_value is a failed result")
        void missingReturnValue() {
            String response = codeunit("SalesTools", "Recalculate", "");

            SoapResult result = SoapResponseParser.parseCodeunit(response, "Recalculate", "SalesTools");

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getMessage()).isEqualTo("return_value element not found.");
        }

        @Test
        @DisplayName("malformed XML is a failed result, not an exception")
        void malformed() {
            SoapResult result = SoapResponseParser.parseCodeunit("<oops", "Recalculate", "SalesTools");

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getMessage()).startsWith("Error parsing response: ");
        }

    }

}
