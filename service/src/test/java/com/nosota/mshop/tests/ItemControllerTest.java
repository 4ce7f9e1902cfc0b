package com.nosota.mshop.tests;

import com.nosota.mshop.TestBase;
import com.nosota.mshop.api.dto.ItemDTO;
import com.nosota.mshop.api.dto.PurchaseDTO;
import com.nosota.mshop.api.model.TransactionType;
import com.nosota.mshop.api.request.AmountRequest;
import com.nosota.mshop.api.request.ItemRequest;
import com.nosota.mshop.api.request.ItemUpdateRequest;
import com.nosota.mshop.api.response.AuthResponse;
import com.nosota.mshop.api.response.PurchaseResponse;
import com.nosota.mshop.model.Item;
import com.nosota.mshop.model.Purchase;
import com.nosota.mshop.model.Transaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Catalog management and purchases through the REST API.
 */
public class ItemControllerTest extends TestBase {

    private String adminToken;

    @BeforeEach
    public void loginAdmin() throws Exception {
        adminToken = adminToken();
    }

    // ==================== Catalog ====================

    @Test
    public void listItems_WithoutToken_ShouldReturnNewestFirst() throws Exception {
        ItemDTO older = createItem(adminToken, uniqueName("Shield"), 150L);
        ItemDTO newer = createItem(adminToken, uniqueName("Helmet"), 80L);

        MvcResult result = mockMvc.perform(get("/api/items"))
                .andExpect(status().isOk())
                .andReturn();

        List<Long> ids = Arrays.stream(objectMapper.readValue(result.getResponse().getContentAsString(), ItemDTO[].class))
                .map(ItemDTO::getId)
                .toList();

        assertThat(ids).contains(older.getId(), newer.getId());
        assertThat(ids.indexOf(newer.getId())).isLessThan(ids.indexOf(older.getId()));
    }

    @Test
    public void createItem_AsAdmin_ShouldStoreCreator() throws Exception {
        ItemRequest request = new ItemRequest("Lantern", "lantern.png", "Lights the way", 45L);

        mockMvc.perform(post("/api/items")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("Lantern"))
                .andExpect(jsonPath("$.icon").value("lantern.png"))
                .andExpect(jsonPath("$.description").value("Lights the way"))
                .andExpect(jsonPath("$.price").value(45))
                .andExpect(jsonPath("$.createdBy").value(ADMIN_USERNAME))
                .andExpect(jsonPath("$.createdAt").exists());
    }

    @Test
    public void createItem_WithInvalidFields_ShouldReturnValidationError() throws Exception {
        mockMvc.perform(post("/api/items")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ItemRequest("Rock", "rock.png", "Just a rock", 0L))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Error"))
                .andExpect(jsonPath("$.message").value("Price must be positive"));

        mockMvc.perform(post("/api/items")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"icon\":\"x\",\"description\":\"y\",\"price\":10}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Name is required"));
    }

    @Test
    public void createItem_WithOverlongName_ShouldReturnValidationError() throws Exception {
        long itemsBefore = itemRepository.count();
        ItemRequest request = new ItemRequest("n".repeat(300), "long.png", "Too long a name", 10L);

        mockMvc.perform(post("/api/items")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Error"))
                .andExpect(jsonPath("$.message").value("Name must be at most 255 characters"));

        assertThat(itemRepository.count()).isEqualTo(itemsBefore);
    }

    @Test
    public void createItem_WithFractionalPrice_ShouldBeRejected() throws Exception {
        mockMvc.perform(post("/api/items")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Half\",\"icon\":\"half.png\",\"description\":\"Half a coin\",\"price\":9.5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));
    }

    @Test
    public void createItem_AsRegularUser_ShouldBeForbidden() throws Exception {
        AuthResponse user = registerUser("shopper");

        mockMvc.perform(post("/api/items")
                        .header(HttpHeaders.AUTHORIZATION, bearer(user.token()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ItemRequest("Map", "map.png", "Old map", 5L))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("Forbidden"))
                .andExpect(jsonPath("$.message").value("Admin access required"));
    }

    @Test
    public void createItem_WithoutToken_ShouldBeUnauthenticated() throws Exception {
        mockMvc.perform(post("/api/items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ItemRequest("Map", "map.png", "Old map", 5L))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Please authenticate"));
    }

    @Test
    public void updateItem_ShouldOverwriteOnlyPresentFields() throws Exception {
        ItemDTO item = createItem(adminToken, uniqueName("Bow"), 120L);

        mockMvc.perform(put("/api/items/{itemId}", item.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ItemUpdateRequest(null, null, null, 95L))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(item.getId()))
                .andExpect(jsonPath("$.name").value(item.getName()))
                .andExpect(jsonPath("$.icon").value(item.getIcon()))
                .andExpect(jsonPath("$.description").value(item.getDescription()))
                .andExpect(jsonPath("$.price").value(95));

        Item stored = itemRepository.findById(item.getId()).orElseThrow();
        assertThat(stored.getPrice()).isEqualTo(95L);
        assertThat(stored.getName()).isEqualTo(item.getName());
        assertThat(stored.getCreatedBy()).isEqualTo(ADMIN_USERNAME);
    }

    @Test
    public void updateItem_WithNonPositivePrice_ShouldReturnValidationError() throws Exception {
        ItemDTO item = createItem(adminToken, uniqueName("Axe"), 60L);

        mockMvc.perform(put("/api/items/{itemId}", item.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ItemUpdateRequest("Axe", null, null, -1L))))
                .andExpect(status().isBadRequest());

        assertThat(itemRepository.findById(item.getId()).orElseThrow().getPrice()).isEqualTo(60L);
    }

    @Test
    public void updateItem_WithOverlongDescription_ShouldReturnValidationError() throws Exception {
        ItemDTO item = createItem(adminToken, uniqueName("Scroll"), 70L);

        mockMvc.perform(put("/api/items/{itemId}", item.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new ItemUpdateRequest(null, null, "d".repeat(2001), null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Description must be at most 2000 characters"));

        assertThat(itemRepository.findById(item.getId()).orElseThrow().getDescription()).isEqualTo(item.getDescription());
    }

    @Test
    public void updateItem_WhenNotFound_ShouldReturn404() throws Exception {
        mockMvc.perform(put("/api/items/{itemId}", Long.MAX_VALUE)
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ItemUpdateRequest("Ghost", null, null, null))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Item not found"));
    }

    @Test
    public void deleteItem_ShouldRemoveItemOnce() throws Exception {
        ItemDTO item = createItem(adminToken, uniqueName("Rope"), 15L);

        mockMvc.perform(delete("/api/items/{itemId}", item.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Item deleted successfully"));

        assertThat(itemRepository.findById(item.getId())).isEmpty();

        mockMvc.perform(delete("/api/items/{itemId}", item.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Item not found"));
    }

    // ==================== Purchases ====================

    @Test
    public void buyItem_AfterDeposit_ShouldDebitPriceAndRecordPurchase() throws Exception {
        AuthResponse alice = registerUser("alice");
        ItemDTO sword = createItem(adminToken, uniqueName("Sword"), 200L);

        mockMvc.perform(post("/api/wallet/deposit")
                        .header(HttpHeaders.AUTHORIZATION, bearer(alice.token()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new AmountRequest(500L))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(1500));

        MvcResult result = mockMvc.perform(post("/api/items/{itemId}/buy", sword.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer(alice.token())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Purchase successful"))
                .andExpect(jsonPath("$.balance").value(1300))
                .andReturn();

        PurchaseResponse response = objectMapper.readValue(result.getResponse().getContentAsString(), PurchaseResponse.class);
        PurchaseDTO purchase = response.purchase();
        assertThat(purchase.getUserId()).isEqualTo(alice.user().getId());
        assertThat(purchase.getItemId()).isEqualTo(sword.getId());
        assertThat(purchase.getItemName()).isEqualTo(sword.getName());
        assertThat(purchase.getPrice()).isEqualTo(200L);
        assertThat(purchase.getPurchaseDate()).isNotNull();

        List<Transaction> ledger = transactionRepository.findByUserIdOrderByCreatedAtDescIdDesc(
                alice.user().getId(), PageRequest.of(0, 10));
        assertThat(ledger).extracting(Transaction::getType)
                .containsExactly(TransactionType.PURCHASE, TransactionType.DEPOSIT);
        assertThat(ledger.get(0).getAmount()).isEqualTo(200L);
        assertThat(ledger.get(0).getItemId()).isEqualTo(sword.getId());
        assertThat(ledger.get(0).getDescription()).isEqualTo("Purchased " + sword.getName() + " for $200");
    }

    @Test
    public void buyItem_WithInsufficientBalance_ShouldFailWithoutSideEffects() throws Exception {
        AuthResponse user = registerUser("poor");
        ItemDTO castle = createItem(adminToken, uniqueName("Castle"), 5000L);

        mockMvc.perform(post("/api/items/{itemId}/buy", castle.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer(user.token())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Insufficient balance"))
                .andExpect(jsonPath("$.details.required").value(5000))
                .andExpect(jsonPath("$.details.balance").value(1000));

        Long userId = user.user().getId();
        assertThat(userRepository.findById(userId).orElseThrow().getWallet()).isEqualTo(1000L);
        assertThat(purchaseRepository.findAllByUserIdOrderByPurchaseDateDescIdDesc(userId)).isEmpty();
        assertThat(transactionRepository.countByUserId(userId)).isZero();
    }

    @Test
    public void buyItem_WhenNotFound_ShouldReturn404() throws Exception {
        AuthResponse user = registerUser("lost");

        mockMvc.perform(post("/api/items/{itemId}/buy", Long.MAX_VALUE)
                        .header(HttpHeaders.AUTHORIZATION, bearer(user.token())))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Item not found"));

        assertThat(userRepository.findById(user.user().getId()).orElseThrow().getWallet()).isEqualTo(1000L);
    }

    @Test
    public void buyItem_WithoutToken_ShouldBeUnauthenticated() throws Exception {
        ItemDTO item = createItem(adminToken, uniqueName("Coin"), 1L);

        mockMvc.perform(post("/api/items/{itemId}/buy", item.getId()))
                .andExpect(status().isUnauthorized());
    }

    @Test
    public void purchase_ShouldKeepPriceAndNameAfterItemChanges() throws Exception {
        AuthResponse user = registerUser("collector");
        ItemDTO gem = createItem(adminToken, uniqueName("Gem"), 300L);

        mockMvc.perform(post("/api/items/{itemId}/buy", gem.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer(user.token())))
                .andExpect(status().isOk());

        mockMvc.perform(put("/api/items/{itemId}", gem.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ItemUpdateRequest("Renamed gem", null, null, 900L))))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/user/purchases")
                        .header(HttpHeaders.AUTHORIZATION, bearer(user.token())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].itemName").value(gem.getName()))
                .andExpect(jsonPath("$[0].price").value(300));

        mockMvc.perform(delete("/api/items/{itemId}", gem.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk());

        List<Purchase> purchases = purchaseRepository.findAllByUserIdOrderByPurchaseDateDescIdDesc(user.user().getId());
        assertThat(purchases).hasSize(1);
        assertThat(purchases.get(0).getItemId()).isEqualTo(gem.getId());
        assertThat(purchases.get(0).getPrice()).isEqualTo(300L);
    }
}
