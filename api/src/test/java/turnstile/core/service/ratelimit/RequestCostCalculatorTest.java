package turnstile.core.service.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("RequestCostCalculator")
class RequestCostCalculatorTest {

    private final RequestCostCalculator calculator = new RequestCostCalculator();

    @ParameterizedTest(name = "{0} {1} costs {2}")
    @CsvSource({
        "GET, /api/v1/users, 1",
        "GET, /api/v1/analytics/daily, 2",
        "GET, /api/v1/admin/system-info, 2",
        "POST, /api/v1/users, 3",
        "PUT, /api/v1/users/42, 3",
        "PATCH, /api/v1/admin/settings, 5",
        "POST, /api/v1/users/bulk-operation, 10",
        "DELETE, /api/v1/users/42, 5",
        "HEAD, /api/v1/users, 1",
        "get, /api/v1/analytics/daily, 2"
    })
    @DisplayName("should weigh requests by method and path")
    void shouldWeighRequests(String method, String path, long expected) {
        assertEquals(expected, calculator.cost(method, path));
    }

    @Test
    @DisplayName("should treat missing method and path as a plain read")
    void shouldHandleMissingInput() {
        assertEquals(1, calculator.cost(null, null));
    }
}
