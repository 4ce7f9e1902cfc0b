package com.nosota.mshop;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.mshop.api.dto.ItemDTO;
import com.nosota.mshop.api.request.ItemRequest;
import com.nosota.mshop.api.request.LoginRequest;
import com.nosota.mshop.api.request.RegisterRequest;
import com.nosota.mshop.api.response.AuthResponse;
import com.nosota.mshop.repository.ItemRepository;
import com.nosota.mshop.repository.PurchaseRepository;
import com.nosota.mshop.repository.TransactionRepository;
import com.nosota.mshop.repository.UserRepository;
import com.nosota.mshop.service.WalletLedgerService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.concurrent.atomic.AtomicLong;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Base class of the integration tests: full application on a random port against the
 * in-memory H2 database of the {@code test} profile.
 *
 * <p>The database is shared by all tests, so every test registers its own users through
 * {@link #registerUser(String)} and asserts on their data only.
 */
@SpringBootTest(
        classes = MshopApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@AutoConfigureMockMvc
@ActiveProfiles("test")
public abstract class TestBase {

    protected static final String ADMIN_USERNAME = "admin";
    protected static final String ADMIN_PASSWORD = "admin-password";
    protected static final String PASSWORD = "password123";

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @Autowired
    protected UserRepository userRepository;

    @Autowired
    protected ItemRepository itemRepository;

    @Autowired
    protected TransactionRepository transactionRepository;

    @Autowired
    protected PurchaseRepository purchaseRepository;

    @Autowired
    protected WalletLedgerService walletLedgerService;

    // Keeps usernames and emails unique across tests sharing the database
    private static final AtomicLong userCounter = new AtomicLong(System.currentTimeMillis());

    protected static String uniqueName(String prefix) {
        return prefix + "-" + userCounter.getAndIncrement();
    }

    /**
     * Registers a new USER through the API and returns its token and view.
     */
    protected AuthResponse registerUser(String prefix) throws Exception {
        String username = uniqueName(prefix);
        RegisterRequest request = new RegisterRequest(prefix, username, username + "@example.com", PASSWORD);

        MvcResult result = mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andReturn();

        return objectMapper.readValue(result.getResponse().getContentAsString(), AuthResponse.class);
    }

    /**
     * Logs in as the bootstrapped admin.
     */
    protected String adminToken() throws Exception {
        LoginRequest request = new LoginRequest(ADMIN_USERNAME, ADMIN_PASSWORD);

        MvcResult result = mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andReturn();

        return objectMapper.readValue(result.getResponse().getContentAsString(), AuthResponse.class).token();
    }

    /**
     * Adds a catalog item as the admin.
     */
    protected ItemDTO createItem(String adminToken, String name, long price) throws Exception {
        ItemRequest request = new ItemRequest(name, "icon-" + name, "Description of " + name, price);

        MvcResult result = mockMvc.perform(post("/api/items")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andReturn();

        return objectMapper.readValue(result.getResponse().getContentAsString(), ItemDTO.class);
    }

    protected static String bearer(String token) {
        return "Bearer " + token;
    }
}
