package com.localllm.agent.api;

import com.localllm.agent.llm.LlmRuntime;
import com.localllm.agent.session.ConversationSessionManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AgentController.class)
class AgentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LlmRuntime llmRuntime;

    @MockBean
    private ConversationSessionManager sessionManager;

    @Test
    void health_reportsModelAndActiveConversations() throws Exception {
        when(llmRuntime.modelName()).thenReturn("qwen2.5:14b");
        when(sessionManager.activeSessions()).thenReturn(2);

        mockMvc.perform(get("/api/v1/agent/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.model").value("qwen2.5:14b"))
                .andExpect(jsonPath("$.activeConversations").value(2));
    }
}
