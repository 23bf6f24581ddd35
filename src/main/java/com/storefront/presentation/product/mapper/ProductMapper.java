package com.storefront.presentation.product.mapper;

import com.storefront.application.product.dto.CreateProductCommand;
import com.storefront.application.product.dto.ProductInfo;
import com.storefront.application.product.dto.UpdateProductCommand;
import com.storefront.presentation.product.request.CreateProductRequest;
import com.storefront.presentation.product.request.UpdateProductRequest;
import com.storefront.presentation.product.response.ProductResponse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * ProductMapper - Presentation layer와 Application layer 간의 DTO 변환
 *
 * Application layer는 Presentation DTO(@JsonProperty 등)에 의존하지 않는다.
 */
@Component
public class ProductMapper {

    public CreateProductCommand toCreateCommand(CreateProductRequest request) {
        return CreateProductCommand.builder()
                .name(request.getName())
                .description(request.getDescription())
                .price(request.getPrice())
                .stock(request.getStock())
                .imageUrl(request.getImageUrl())
                .build();
    }

    public UpdateProductCommand toUpdateCommand(UpdateProductRequest request) {
        return UpdateProductCommand.builder()
                .name(request.getName())
                .description(request.getDescription())
                .price(request.getPrice())
                .stock(request.getStock())
                .imageUrl(request.getImageUrl())
                .build();
    }

    public ProductResponse toProductResponse(ProductInfo info) {
        return ProductResponse.builder()
                .productId(info.getProductId())
                .name(info.getName())
                .description(info.getDescription())
                .price(info.getPrice())
                .stock(info.getStock())
                .imageUrl(info.getImageUrl())
                .createdAt(info.getCreatedAt())
                .build();
    }

    public List<ProductResponse> toProductResponses(List<ProductInfo> infos) {
        return infos.stream()
                .map(this::toProductResponse)
                .collect(Collectors.toList());
    }
}
