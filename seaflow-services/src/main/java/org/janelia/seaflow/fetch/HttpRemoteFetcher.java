package org.janelia.seaflow.fetch;

import java.io.IOException;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.dataformat.xml.XmlMapper;

import org.apache.commons.lang3.StringUtils;
import org.apache.http.HttpStatus;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches objects from an HTTP(S) object store endpoint, e.g. a bucket URL. References are resolved against the
 * base URL. Listing uses the S3 ListObjectsV2 protocol. Credentials, if any, are the concern of whoever provides
 * the endpoint.
 */
public class HttpRemoteFetcher implements RemoteObjectStore {

    private static final Logger LOG = LoggerFactory.getLogger(HttpRemoteFetcher.class);
    private static final XmlMapper XML_MAPPER = new XmlMapper();

    private final String baseURL;
    private final CloseableHttpClient httpClient;

    public HttpRemoteFetcher(String baseURL, int maxConnections, int connectTimeoutMillis, int socketTimeoutMillis) {
        this(baseURL, createHttpClient(maxConnections, connectTimeoutMillis, socketTimeoutMillis));
    }

    HttpRemoteFetcher(String baseURL, CloseableHttpClient httpClient) {
        this.baseURL = StringUtils.removeEnd(baseURL, "/");
        this.httpClient = httpClient;
    }

    private static CloseableHttpClient createHttpClient(int maxConnections, int connectTimeoutMillis, int socketTimeoutMillis) {
        PoolingHttpClientConnectionManager connManager = new PoolingHttpClientConnectionManager();
        connManager.setMaxTotal(maxConnections);
        connManager.setDefaultMaxPerRoute(maxConnections);
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(connectTimeoutMillis)
                .setSocketTimeout(socketTimeoutMillis)
                .build();
        return HttpClients.custom()
                .setConnectionManager(connManager)
                .setDefaultRequestConfig(requestConfig)
                .build();
    }

    String getObjectURL(String reference) {
        return baseURL + "/" + StringUtils.removeStart(reference, "/");
    }

    String getListingURL(String prefix, String continuationToken) {
        try {
            URIBuilder uriBuilder = new URIBuilder(baseURL + "/")
                    .addParameter("list-type", "2")
                    .addParameter("prefix", prefix);
            if (continuationToken != null) {
                uriBuilder.addParameter("continuation-token", continuationToken);
            }
            return uriBuilder.build().toString();
        } catch (URISyntaxException e) {
            throw new FetchException("Invalid object store URL " + baseURL, e);
        }
    }

    @Override
    public byte[] fetch(String reference) {
        return get(getObjectURL(reference));
    }

    @Override
    public List<String> listObjects(String prefix) {
        List<String> keys = new ArrayList<>();
        Optional<String> pageToken = Optional.empty();
        do {
            ObjectListing listing = readListing(get(getListingURL(prefix, pageToken.orElse(null))));
            keys.addAll(listing.getKeys());
            pageToken = listing.getNextPageToken();
        } while (pageToken.isPresent());
        LOG.info("Found {} objects under {}/{}", keys.size(), baseURL, prefix);
        return keys;
    }

    private ObjectListing readListing(byte[] content) {
        try {
            return XML_MAPPER.readValue(content, ObjectListing.class);
        } catch (IOException e) {
            throw new FetchException("Invalid object listing from " + baseURL, e);
        }
    }

    private byte[] get(String url) {
        LOG.debug("GET {}", url);
        HttpGet get = new HttpGet(url);
        try (CloseableHttpResponse response = httpClient.execute(get)) {
            int statusCode = response.getStatusLine().getStatusCode();
            if (statusCode != HttpStatus.SC_OK) {
                EntityUtils.consumeQuietly(response.getEntity());
                throw new FetchException("GET " + url + " returned status " + statusCode);
            }
            return EntityUtils.toByteArray(response.getEntity());
        } catch (IOException e) {
            throw new FetchException("Error reading " + url, e);
        }
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
