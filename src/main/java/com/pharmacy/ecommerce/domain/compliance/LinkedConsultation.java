package com.pharmacy.ecommerce.domain.compliance;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class LinkedConsultation {

    private final String id;
    private final String status;
}
