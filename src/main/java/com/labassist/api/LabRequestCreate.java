package com.labassist.api;

import com.labassist.entity.RequestPriority;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record LabRequestCreate(
        @NotNull @Size(min = 1, max = 10000) String text,
        RequestPriority priority
) {
}
