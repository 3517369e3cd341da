package com.github.dimitryivaniuta.labelbridge.dashboard;

import com.github.dimitryivaniuta.labelbridge.credential.AuthenticatedPrincipal;
import com.github.dimitryivaniuta.labelbridge.web.RequestContextKeys;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/dashboard")
@RequiredArgsConstructor
public class DashboardController {

    private final DashboardService dashboard;

    @GetMapping("/stats")
    public DashboardStats stats(
            @RequestAttribute(RequestContextKeys.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal) {
        return dashboard.stats(principal);
    }
}
