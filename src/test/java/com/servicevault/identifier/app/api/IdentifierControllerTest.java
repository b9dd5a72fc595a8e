package com.servicevault.identifier.app.api;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.servicevault.identifier.app.Fixtures;
import com.servicevault.identifier.app.repository.memory.InMemoryPropertyCatalog;
import com.servicevault.identifier.app.session.InMemorySessionResolver;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

@SpringBootTest
@AutoConfigureMockMvc
class IdentifierControllerTest {

  private static final String OWNER_SESSION = "session-owner";
  private static final String STRANGER_SESSION = "session-stranger";

  @Autowired private MockMvc mvc;
  @Autowired private ObjectMapper om;
  @Autowired private InMemoryPropertyCatalog catalog;
  @Autowired private InMemorySessionResolver sessions;

  private String propertyId;

  @BeforeEach
  void setUp() {
    propertyId = "prop-" + UUID.randomUUID();
    Fixtures.seed(catalog, propertyId);
    sessions.bind(OWNER_SESSION, Fixtures.OWNER);
    sessions.bind(STRANGER_SESSION, Fixtures.STRANGER);
  }

  @Test
  void missingSessionIs401() throws Exception {
    mvc.perform(get("/identifier/" + propertyId))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error").value("UNAUTHORIZED"))
        .andExpect(jsonPath("$.message").value("missing_session"));

    mvc.perform(get("/identifier/" + propertyId).header("Authorization", "Bearer nope"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.message").value("invalid_session"));
  }

  @Test
  void freshPropertyIsUnissuedWithDefaults() throws Exception {
    mvc.perform(owner(get("/identifier/" + propertyId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UNISSUED"))
        .andExpect(jsonPath("$.masterIdentifier").doesNotExist())
        .andExpect(jsonPath("$.publicVisibility.showFullAddress").value(false))
        .andExpect(jsonPath("$.publicVisibility.showContractors").value(true))
        .andExpect(jsonPath("$.publicVisibility.showDocuments").value(false))
        .andExpect(jsonPath("$.publicVisibility.showCosts").value(false));
  }

  @Test
  void regenerateIssuesTokenAndPublicUrl() throws Exception {
    JsonNode issued = regenerate("{\"regenerate\":true,\"privacySettings\":{\"showCosts\":true}}");

    String token = issued.get("masterIdentifier").asText();
    assertTrue(token.startsWith("HOME-"));
    assertEquals("ACTIVE", issued.get("status").asText());
    assertTrue(issued.get("publicVisibility").get("showCosts").asBoolean());
    assertTrue(issued.get("publicUrl").asText().endsWith("/property/public/" + token));
  }

  @Test
  void privacyUpdateReturnsMergedState() throws Exception {
    regenerate("{\"regenerate\":true}");

    mvc.perform(
            owner(post("/identifier/" + propertyId))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"privacySettings\":{\"showDocuments\":true}}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ACTIVE"))
        .andExpect(jsonPath("$.publicVisibility.showDocuments").value(true))
        .andExpect(jsonPath("$.publicVisibility.showContractors").value(true));
  }

  @Test
  void strangerIsForbidden() throws Exception {
    mvc.perform(
            withSession(post("/identifier/" + propertyId + "/revoke"), STRANGER_SESSION))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.error").value("FORBIDDEN"));
  }

  @Test
  void unknownPropertyIs404() throws Exception {
    mvc.perform(owner(get("/identifier/no-such-property")))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("NOT_FOUND"));
  }

  @Test
  void nonBooleanPrivacyValueIs400() throws Exception {
    mvc.perform(
            owner(post("/identifier/" + propertyId))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"privacySettings\":{\"showCosts\":\"true\"}}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
        .andExpect(jsonPath("$.message").value("Privacy setting showCosts must be boolean"));
  }

  @Test
  void unknownPrivacyKeyIs400() throws Exception {
    mvc.perform(
            owner(post("/identifier/" + propertyId))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"privacySettings\":{\"showEverything\":true}}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Invalid privacy settings keys"));
  }

  @Test
  void nonBooleanRegenerateIs400() throws Exception {
    mvc.perform(
            owner(post("/identifier/" + propertyId))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"regenerate\":\"yes\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("regenerate must be boolean"));
  }

  @Test
  void revokeThenEditIsConflictUntilRegenerate() throws Exception {
    regenerate("{\"regenerate\":true}");

    mvc.perform(owner(post("/identifier/" + propertyId + "/revoke")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true));

    mvc.perform(owner(get("/identifier/" + propertyId)))
        .andExpect(jsonPath("$.status").value("REVOKED"))
        .andExpect(jsonPath("$.masterIdentifier", startsWith("HOME-")))
        .andExpect(jsonPath("$.publicUrl").doesNotExist());

    mvc.perform(
            owner(post("/identifier/" + propertyId))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"privacySettings\":{\"showCosts\":true}}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.error").value("CONFLICT"))
        .andExpect(jsonPath("$.regenerateRequired").value(true));

    JsonNode reissued = regenerate("{\"regenerate\":true}");
    assertEquals("ACTIVE", reissued.get("status").asText());
  }

  @Test
  void revokeIsIdempotent() throws Exception {
    mvc.perform(owner(post("/identifier/" + propertyId + "/revoke")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true));
    mvc.perform(owner(post("/identifier/" + propertyId + "/revoke")))
        .andExpect(status().isOk());
  }

  @Test
  void classificationRequiresAssetType() throws Exception {
    String assetId = propertyId + ":" + Fixtures.LEGACY;

    mvc.perform(
            owner(put("/properties/" + propertyId + "/assets/" + assetId + "/classification"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

    mvc.perform(
            owner(put("/properties/" + propertyId + "/assets/" + assetId + "/classification"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"assetType\":\"PERSONAL\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.assetType").value("PERSONAL"));
  }

  @Test
  void ownerHistoryShowsEverything() throws Exception {
    mvc.perform(owner(get("/properties/" + propertyId + "/history")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.viewer").value("OWNER"))
        .andExpect(jsonPath("$.assets.length()").value(3))
        .andExpect(jsonPath("$.documents.length()").value(3))
        .andExpect(jsonPath("$.property.address.line1").value("42 Maple Street"));
  }

  private JsonNode regenerate(String body) throws Exception {
    String json =
        mvc.perform(
                owner(post("/identifier/" + propertyId))
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body))
            .andExpect(status().isOk())
            .andReturn()
            .getResponse()
            .getContentAsString();
    return om.readTree(json);
  }

  private static MockHttpServletRequestBuilder owner(MockHttpServletRequestBuilder req) {
    return withSession(req, OWNER_SESSION);
  }

  private static MockHttpServletRequestBuilder withSession(
      MockHttpServletRequestBuilder req, String session) {
    return req.header("Authorization", "Bearer " + session);
  }
}
