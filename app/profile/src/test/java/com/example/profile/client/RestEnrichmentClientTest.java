package com.example.profile.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.profile.model.AddressDetail;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class RestEnrichmentClientTest {

  @Test
  void fetchReturnsAddressDetail() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://geo.test/addresses/geo-1"))
        .andExpect(method(GET))
        .andRespond(
            withSuccess(
                """
                {"geoAddressId":"geo-1","line1":"1 Main St","city":"Springfield",
                "postalCode":"62701","countryCode":"US","latitude":39.8,"longitude":-89.6}
                """,
                MediaType.APPLICATION_JSON));

    final AddressDetail detail = fixture.client.fetch("geo-1").orElseThrow();

    assertThat(detail.city()).isEqualTo("Springfield");
    assertThat(detail.latitude()).isEqualTo(39.8d);
    fixture.server.verify();
  }

  @Test
  void fetchMaps404ToEmpty() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://geo.test/addresses/geo-404"))
        .andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertThat(fixture.client.fetch("geo-404")).isEmpty();
  }

  @Test
  void fetchMaps5xxToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://geo.test/addresses/geo-1"))
        .andRespond(withServerError());

    assertReason(fixture, EnrichmentUnavailableException.Reason.BAD_GATEWAY);
  }

  @Test
  void fetchMapsMalformedBodyToInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://geo.test/addresses/geo-1"))
        .andRespond(withSuccess("{not json", MediaType.APPLICATION_JSON));

    assertReason(fixture, EnrichmentUnavailableException.Reason.INVALID_RESPONSE);
  }

  @Test
  void fetchMapsTimeoutToTimeout() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://geo.test/addresses/geo-1"))
        .andRespond(
            request -> {
              throw new SocketTimeoutException("Read timed out");
            });

    assertReason(fixture, EnrichmentUnavailableException.Reason.TIMEOUT);
  }

  @Test
  void fetchMapsConnectionFailureToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://geo.test/addresses/geo-1"))
        .andRespond(
            request -> {
              throw new ConnectException("Connection refused");
            });

    assertReason(fixture, EnrichmentUnavailableException.Reason.BAD_GATEWAY);
  }

  @Test
  void fetchRejectsBlankReference() {
    final ClientFixture fixture = newFixture();

    assertThatThrownBy(() -> fixture.client.fetch(" "))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private void assertReason(ClientFixture fixture, EnrichmentUnavailableException.Reason reason) {
    assertThatThrownBy(() -> fixture.client.fetch("geo-1"))
        .isInstanceOf(EnrichmentUnavailableException.class)
        .satisfies(
            ex -> {
              final EnrichmentUnavailableException unavailable =
                  (EnrichmentUnavailableException) ex;
              assertThat(unavailable.reason()).isEqualTo(reason);
              assertThat(unavailable.dependency()).isEqualTo("geo");
            });
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://geo.test").build();
    return new ClientFixture(
        new RestEnrichmentClient<>(
            "geo", restClient, "/addresses/{geoAddressId}", AddressDetail.class),
        server);
  }

  private record ClientFixture(
      RestEnrichmentClient<AddressDetail> client, MockRestServiceServer server) {}
}
