package com.delta.research.pipeline.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class ResearchRunApiTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private ObjectMapper objectMapper;

    private MockMvc mockMvc;
    private String tenantId;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
        tenantId = "tenant-" + UUID.randomUUID();
    }

    @Test
    void createAttachAndStartRun() throws Exception {
        String runId = createRun("{\"name\":\"gulf energy\",\"target_countries\":[\"om\"]}");

        mockMvc.perform(get("/api/runs/" + runId).header(ResearchRunController.TENANT_HEADER, tenantId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.name").value("gulf energy"))
            .andExpect(jsonPath("$.status").value("queued"));

        mockMvc.perform(post("/api/runs/" + runId + "/sources")
                .header(ResearchRunController.TENANT_HEADER, tenantId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source_type\":\"list\",\"content\":\"Acme Solar Holdings\\nBlue Ridge Power Company\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.sourceType").value("list"));

        mockMvc.perform(post("/api/runs/" + runId + "/start").header(ResearchRunController.TENANT_HEADER, tenantId))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.status").value("queued"));

        mockMvc.perform(post("/api/runs/" + runId + "/sources")
                .header(ResearchRunController.TENANT_HEADER, tenantId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source_type\":\"text\",\"content\":\"late addition\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("plan_locked"));

        mockMvc.perform(get("/api/runs/" + runId + "/steps").header(ResearchRunController.TENANT_HEADER, tenantId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(7))
            .andExpect(jsonPath("$[0].stepKey").value("fetch_url_sources"));
    }

    @Test
    void cancellingAnUnclaimedRunIsImmediate() throws Exception {
        String runId = createRun("{\"name\":\"cancel me\"}");
        mockMvc.perform(post("/api/runs/" + runId + "/start").header(ResearchRunController.TENANT_HEADER, tenantId))
            .andExpect(status().isAccepted());

        mockMvc.perform(post("/api/runs/" + runId + "/cancel").header(ResearchRunController.TENANT_HEADER, tenantId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("cancelled"));

        mockMvc.perform(post("/api/runs/" + runId + "/start").header(ResearchRunController.TENANT_HEADER, tenantId))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("invalid_run_state"));
    }

    @Test
    void rankingExportsCarryDownloadHeaders() throws Exception {
        String runId = createRun(null);

        mockMvc.perform(get("/api/runs/" + runId + "/prospects-ranked.csv").header(ResearchRunController.TENANT_HEADER, tenantId))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith("text/csv"))
            .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString(".csv")))
            .andExpect(content().string(startsWith("rank,company_name,score_total")));

        mockMvc.perform(get("/api/runs/" + runId + "/prospects-ranked.json").header(ResearchRunController.TENANT_HEADER, tenantId))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
            .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString(".json")));
    }

    @Test
    void errorsUseTheSharedErrorBody() throws Exception {
        mockMvc.perform(get("/api/runs/" + UUID.randomUUID()).header(ResearchRunController.TENANT_HEADER, tenantId))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("not_found"));

        mockMvc.perform(get("/api/runs"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("missing_header"));

        String runId = createRun(null);
        mockMvc.perform(post("/api/runs/" + runId + "/sources")
                .header(ResearchRunController.TENANT_HEADER, tenantId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source_type\":\"url\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));

        mockMvc.perform(get("/api/runs/" + runId).header(ResearchRunController.TENANT_HEADER, "someone-else"))
            .andExpect(status().isNotFound());
    }

    @Test
    void workerStatusReportsDaemonState() throws Exception {
        mockMvc.perform(get("/api/worker/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.daemonRunning").value(false))
            .andExpect(jsonPath("$.workerId").value(startsWith("worker-")));
    }

    private String createRun(String body) throws Exception {
        var request = post("/api/runs").header(ResearchRunController.TENANT_HEADER, tenantId);
        if (body != null) {
            request = request.contentType(MediaType.APPLICATION_JSON).content(body);
        }
        String response = mockMvc.perform(request)
            .andExpect(status().isCreated())
            .andReturn()
            .getResponse()
            .getContentAsString();
        JsonNode json = objectMapper.readTree(response);
        return json.path("id").asText();
    }
}
