package com.github.passthrough.backend.debrid;

import com.github.passthrough.backend.debrid.models.AddMagnetResponse;
import com.github.passthrough.backend.debrid.models.DebridTorrentInfo;
import com.github.passthrough.backend.debrid.models.UnrestrictResponse;

import java.util.Collection;
import java.util.Set;

/**
 * The debrid service fetches torrents server-side and exposes them as direct download links.
 * All calls are blocking and throw a {@link org.springframework.web.client.RestClientException} on transport failures.
 */
public interface DebridService {
    /**
     * The file selection value which selects all files of a torrent.
     */
    String ALL_FILES = "all";

    /**
     * Add the given magnet link to the debrid provider.
     *
     * @param magnetLink The magnet link of the torrent.
     * @return Returns the provider-side torrent.
     * @throws DebridException Is thrown when the provider didn't return a torrent id.
     */
    AddMagnetResponse addMagnet(String magnetLink);

    /**
     * Get the current info of the given torrent.
     *
     * @param torrentId The provider-side torrent id.
     * @return Returns the torrent info.
     */
    DebridTorrentInfo getTorrentInfo(String torrentId);

    /**
     * Select the files of the torrent which should be made available.
     *
     * @param torrentId The provider-side torrent id.
     * @param fileIds   The comma separated file ids or {@link #ALL_FILES}.
     */
    void selectFiles(String torrentId, String fileIds);

    /**
     * Unrestrict the given hoster link into a direct download link.
     *
     * @param link The link to unrestrict.
     * @return Returns the unrestricted link.
     */
    UnrestrictResponse unrestrictLink(String link);

    /**
     * Get the info hashes which are already cached on the debrid provider.
     *
     * @param infoHashes The info hashes to check.
     * @return Returns the lower-cased info hashes which are instantly available.
     */
    Set<String> getCachedInfoHashes(Collection<String> infoHashes);
}
