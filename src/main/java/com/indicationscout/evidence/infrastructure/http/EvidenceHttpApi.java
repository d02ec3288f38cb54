package com.indicationscout.evidence.infrastructure.http;

import okhttp3.ResponseBody;
import retrofit2.Call;
import retrofit2.http.Body;
import retrofit2.http.GET;
import retrofit2.http.POST;
import retrofit2.http.QueryMap;
import retrofit2.http.Url;

import java.util.Map;

/**
 * Raw transport for an evidence source. Bodies are returned undecoded so the
 * executor can classify malformed replies itself.
 */
public interface EvidenceHttpApi {

    @GET
    Call<ResponseBody> get(@Url String path, @QueryMap Map<String, String> query);

    @POST
    Call<ResponseBody> post(@Url String path, @Body GraphQlRequest request);
}
