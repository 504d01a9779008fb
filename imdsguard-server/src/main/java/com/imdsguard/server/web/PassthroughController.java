package com.imdsguard.server.web;

import com.imdsguard.server.forward.MetadataForwarder;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Lowest-priority mapping: everything not claimed by a more specific pattern goes to the real endpoint. */
@RestController
public class PassthroughController {

    private final MetadataForwarder forwarder;

    public PassthroughController(MetadataForwarder forwarder) {
        this.forwarder = forwarder;
    }

    @RequestMapping("/{*path}")
    public void forward(HttpServletRequest request, HttpServletResponse response) throws IOException {
        forwarder.forward(request, response);
    }
}
