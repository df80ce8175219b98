package com.finpal.assistant.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.finpal.assistant.WebIntegrationTestSupport;
import com.finpal.assistant.model.FinancialRecord;
import com.finpal.assistant.repository.FinanceRecordRepository;
import com.finpal.assistant.user.UserRepository;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

class AuthControllerTest extends WebIntegrationTestSupport {

    @Autowired
    UserRepository userRepository;

    @Autowired
    FinanceRecordRepository financeRecordRepository;

    @Test
    void loginReturnsUserFinanceAndTokenCookie() throws Exception {
        String body = objectMapper.writeValueAsString(new AuthController.LoginRequest(DEMO_PHONE, "demo123"));
        MvcResult result = mockMvc.perform(post("/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.user.phone").value(DEMO_PHONE))
                .andExpect(jsonPath("$.user.name").value("Demo User"))
                .andExpect(jsonPath("$.finance.bank_balance").value(850000))
                .andExpect(jsonPath("$.tokenType").value("Bearer"))
                .andReturn();

        String setCookie = result.getResponse().getHeader("Set-Cookie");
        assertThat(setCookie).isNotNull().contains("finpal_token=").contains("HttpOnly");
        String token = objectMapper.readTree(result.getResponse().getContentAsString()).get("accessToken").asText();
        assertThat(token.split("\\.")).hasSize(3);
    }

    @Test
    void loginWithWrongPasswordIsUnauthorized() throws Exception {
        mockMvc.perform(post("/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phone\":\"" + DEMO_PHONE + "\",\"password\":\"nope\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"))
                .andExpect(jsonPath("$.message").value("Invalid credentials"));
    }

    @Test
    void loginWithoutPasswordIsBadRequest() throws Exception {
        mockMvc.perform(post("/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phone\":\"" + DEMO_PHONE + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Missing phone or password"));
    }

    @Test
    void registerThenLoginWithEmptyFinanceDefaults() throws Exception {
        String phone = newPhone();
        String form = objectMapper.writeValueAsString(Map.of(
                "name", "Meera", "phone", phone, "password", "pw-1", "email", "meera@example.com"));

        mockMvc.perform(post("/register").contentType(MediaType.APPLICATION_JSON).content(form))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Registered successfully"));

        assertThat(userRepository.findByPhone(phone).orElseThrow().getProfile())
                .containsEntry("email", "meera@example.com");
        assertThat(financeRecordRepository.findByIdentifier(phone)).contains(FinancialRecord.zeroed());

        mockMvc.perform(post("/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phone\":\"" + phone + "\",\"password\":\"pw-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.finance.loan").value(0));
    }

    @Test
    void registerKeepsExistingFinanceRecord() throws Exception {
        String phone = newPhone();
        financeRecordRepository.save(phone, new FinancialRecord(42L, null, null, null, null));

        mockMvc.perform(post("/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"N\",\"phone\":\"" + phone + "\",\"password\":\"p\"}"))
                .andExpect(status().isOk());

        assertThat(financeRecordRepository.findByIdentifier(phone))
                .contains(new FinancialRecord(42L, null, null, null, null));
    }

    @Test
    void registeringTwiceIsConflict() throws Exception {
        mockMvc.perform(post("/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Again\",\"phone\":\"" + DEMO_PHONE + "\",\"password\":\"x\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.details.success").value(false))
                .andExpect(jsonPath("$.message").value("Phone already registered"));
    }

    @Test
    void registerWithMissingFieldsIsBadRequest() throws Exception {
        mockMvc.perform(post("/register").contentType(MediaType.APPLICATION_JSON).content("{\"name\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"))
                .andExpect(jsonPath("$.message").value("Missing name/phone/password"));
    }
}
