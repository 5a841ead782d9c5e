package com.intelhub.backend.transfer;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImportResult {
    private String collection;
    private int imported;
    private int duplicates;
    private int rejected;
}
