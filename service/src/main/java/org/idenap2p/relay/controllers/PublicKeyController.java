/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.controllers;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HEAD;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import javax.annotation.Nullable;
import org.apache.commons.lang3.StringUtils;
import org.idenap2p.relay.entities.BatchAddressesRequest;
import org.idenap2p.relay.entities.DeletePublicKeyResponse;
import org.idenap2p.relay.entities.ErrorResponse;
import org.idenap2p.relay.entities.PublicKeyBatchResponse;
import org.idenap2p.relay.entities.StorePublicKeyRequest;
import org.idenap2p.relay.entities.StorePublicKeyResponse;
import org.idenap2p.relay.storage.PublicKeyDirectory;
import org.idenap2p.relay.storage.PublicKeyDirectoryStats;
import org.idenap2p.relay.storage.PublicKeyRecord;
import org.idenap2p.relay.util.Addresses;

@Path("/api/public-keys")
@Produces(MediaType.APPLICATION_JSON)
public class PublicKeyController {

  private final PublicKeyDirectory publicKeyDirectory;

  public PublicKeyController(final PublicKeyDirectory publicKeyDirectory) {
    this.publicKeyDirectory = publicKeyDirectory;
  }

  @POST
  @Consumes(MediaType.APPLICATION_JSON)
  public StorePublicKeyResponse storePublicKey(@Nullable final StorePublicKeyRequest request) {
    final String address = Addresses.requireValid(request != null ? request.address() : null);

    if (StringUtils.isEmpty(request.publicKey())) {
      throw new InvalidRequestException("Invalid public key");
    }

    final PublicKeyRecord record = publicKeyDirectory.store(address, request.publicKey());
    return new StorePublicKeyResponse(true, record.address(), record.updatedAt());
  }

  @GET
  @Path("/{address}")
  public Response getPublicKey(@PathParam("address") final String address) {
    return publicKeyDirectory.get(Addresses.requireValid(address))
        .map(publicKeyRecord -> Response.ok(publicKeyRecord).build())
        .orElseGet(() -> Response.status(Response.Status.NOT_FOUND)
            .type(MediaType.APPLICATION_JSON_TYPE)
            .entity(new ErrorResponse("Public key not found for this address"))
            .build());
  }

  @POST
  @Path("/batch")
  @Consumes(MediaType.APPLICATION_JSON)
  public PublicKeyBatchResponse getPublicKeys(@Nullable final BatchAddressesRequest request) {
    final List<String> addresses = BatchAddresses.requireValid(request);

    return new PublicKeyBatchResponse(publicKeyDirectory.getMultiple(addresses));
  }

  @HEAD
  @Path("/{address}")
  public Response hasPublicKey(@PathParam("address") final String address) {
    if (!Addresses.isValid(address)) {
      return Response.status(Response.Status.BAD_REQUEST).build();
    }

    return Response.status(publicKeyDirectory.exists(address) ? Response.Status.OK : Response.Status.NOT_FOUND)
        .build();
  }

  @DELETE
  @Path("/{address}")
  public DeletePublicKeyResponse deletePublicKey(@PathParam("address") final String address) {
    return DeletePublicKeyResponse.forResult(publicKeyDirectory.delete(Addresses.requireValid(address)));
  }

  @GET
  @Path("/stats/all")
  public PublicKeyDirectoryStats getStats() {
    return publicKeyDirectory.getStats();
  }
}
