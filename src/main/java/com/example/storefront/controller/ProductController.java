package com.example.storefront.controller;

import com.example.storefront.model.ProductDraft;
import com.example.storefront.model.ProductUpdate;
import com.example.storefront.model.ProductView;
import com.example.storefront.service.ProductService;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.RequiredArgsConstructor;
import org.hibernate.validator.constraints.URL;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

import static com.example.storefront.controller.CategoryController.NOT_BLANK_MESSAGE;
import static com.example.storefront.controller.CategoryController.NOT_BLANK_PATTERN;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Validated
public class ProductController {

    static final String HTTP_URL_PATTERN = "(?i)https?://.+";
    static final String HTTP_URL_MESSAGE = "must be a valid http or https URL";

    private final ProductService productService;

    @GetMapping("/products")
    public List<ProductView> listProducts(@RequestParam(name = "category_slug", required = false) String categorySlug) {
        return productService.listProducts(categorySlug);
    }

    @GetMapping("/products/{id}")
    public ProductView getProduct(@PathVariable String id) {
        return productService.getProduct(id);
    }

    @PostMapping("/admin/products")
    public ResponseEntity<ProductView> create(@Valid @RequestBody CreateProductRequest request) {
        ProductDraft draft = ProductDraft.builder()
            .title(request.title())
            .description(request.description())
            .price(request.price())
            .categorySlug(request.categorySlug())
            .imageUrl(request.imageUrl())
            .inStock(request.inStock() == null || request.inStock())
            .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(productService.createProduct(draft));
    }

    @PutMapping("/admin/products/{id}")
    public ProductView update(@PathVariable String id, @Valid @RequestBody UpdateProductRequest request) {
        return productService.updateProduct(id, request.toUpdate());
    }

    @DeleteMapping("/admin/products/{id}")
    public DeleteResponse delete(@PathVariable String id) {
        productService.deleteProduct(id);
        return DeleteResponse.SUCCESS;
    }

    public record CreateProductRequest(
        @NotBlank String title,
        String description,
        @NotNull @PositiveOrZero Double price,
        @JsonProperty("category_slug") @NotBlank String categorySlug,
        @JsonProperty("image_url") @URL(regexp = HTTP_URL_PATTERN, message = HTTP_URL_MESSAGE) String imageUrl,
        @JsonProperty("in_stock") Boolean inStock
    ) {
    }

    public record UpdateProductRequest(
        @Pattern(regexp = NOT_BLANK_PATTERN, message = NOT_BLANK_MESSAGE) String title,
        String description,
        @PositiveOrZero Double price,
        @JsonProperty("category_slug") @Pattern(regexp = NOT_BLANK_PATTERN, message = NOT_BLANK_MESSAGE) String categorySlug,
        @JsonProperty("image_url") @URL(regexp = HTTP_URL_PATTERN, message = HTTP_URL_MESSAGE) String imageUrl,
        @JsonProperty("in_stock") Boolean inStock
    ) {

        ProductUpdate toUpdate() {
            return ProductUpdate.builder()
                .title(Optional.ofNullable(title))
                .description(Optional.ofNullable(description))
                .price(Optional.ofNullable(price))
                .categorySlug(Optional.ofNullable(categorySlug))
                .imageUrl(Optional.ofNullable(imageUrl))
                .inStock(Optional.ofNullable(inStock))
                .build();
        }
    }
}
